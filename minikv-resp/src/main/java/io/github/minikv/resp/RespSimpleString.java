package io.github.minikv.resp;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespSimpleString extends RespString {
    public static final char firstChar = '+';

    public static final RespSimpleString OK   = withUTF8("OK");
    public static final RespSimpleString PONG = withUTF8("PONG");

    public static RespSimpleString withUTF8(String content) {
        return new RespSimpleString(content, StandardCharsets.UTF_8);
    }

    public static RespSimpleString with(String content, Charset charset) {
        return new RespSimpleString(content, charset);
    }

    public RespSimpleString(String content, Charset charset) {
        super(content, charset);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
