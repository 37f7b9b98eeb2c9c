package com.pairstream.util;

import com.pairstream.server.pipeline.sample.Rectangle;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text form of a crop rectangle as stored in the metadata table: {@code ((x1, y1), (x2, y2))}.
 */
public class RectangleCodec {

    private static final Pattern RECT = Pattern.compile(
            "^\\s*[(\\[]\\s*[(\\[]\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*[)\\]]\\s*,"
                    + "\\s*[(\\[]\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*[)\\]]\\s*[)\\]]\\s*$");

    public static String toText(Rectangle rect) {
        if (rect == null) {
            return null;
        }
        return rect.toString();
    }

    /**
     * @throws IllegalArgumentException if the text is not a pair of integer points
     */
    public static Rectangle fromText(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = RECT.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed rectangle: '" + text + "'");
        }
        return new Rectangle(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)));
    }
}
