package com.pairstream.util;

import com.pairstream.server.pipeline.sample.Rectangle;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RectangleCodecTest {

    @Test
    public void testParsesStoredForm() {
        Rectangle r = RectangleCodec.fromText("((10, 20), (74, 84))");
        Assertions.assertEquals(new Rectangle(10, 20, 74, 84), r);
        Assertions.assertEquals(64, r.width());
        Assertions.assertEquals(64, r.height());
    }

    @Test
    public void testAcceptsListBracketsAndWhitespace() {
        Assertions.assertEquals(new Rectangle(0, 0, 5, 6), RectangleCodec.fromText(" [[0,0],[5,6]] "));
        Assertions.assertEquals(new Rectangle(-1, 2, 3, 4), RectangleCodec.fromText("((-1, 2), (3, 4))"));
    }

    @Test
    public void testTextMatchesRectangleToString() {
        Rectangle r = new Rectangle(1, 2, 3, 4);
        Assertions.assertEquals("((1, 2), (3, 4))", RectangleCodec.toText(r));
        Assertions.assertEquals(r, RectangleCodec.fromText(RectangleCodec.toText(r)));
    }

    @Test
    public void testNullPassesThrough() {
        Assertions.assertNull(RectangleCodec.fromText(null));
        Assertions.assertNull(RectangleCodec.toText(null));
    }

    @Test
    public void testMalformedTextRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> RectangleCodec.fromText("((1, 2), (3))"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> RectangleCodec.fromText("1,2,3,4"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> RectangleCodec.fromText("((a, 2), (3, 4))"));
    }
}
