package com.opensiddur.pipeline;

import com.opensiddur.errors.MalformedRangeException;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.MilestoneNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.TextNode;
import com.opensiddur.models.TransclusionRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.opensiddur.pipeline.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

class FragmentExtractorTest {

    private final FragmentExtractor extractor = new FragmentExtractor();

    private final ElementNode v1 = p("one");
    private final ElementNode v2 = p("two");
    private final ElementNode v3 = p("three");
    private final ElementNode chapter = element("div", v1, v2, v3);
    private final DocumentOrder order = new DocumentOrder(new Document("p", "d", null, element("div", chapter)));

    @Test
    void singleElementIsItsOwnFragment() {
        Fragment fragment = extractor.extract(order, v2, v2, TransclusionRef.Mode.EXTERNAL);
        assertEquals(List.of(v2), fragment.getTopLevel());
        assertEquals(Fragment.Coverage.FULL, fragment.coverage(v2.getChildren().get(0)));
        assertEquals(Fragment.Coverage.NONE, fragment.coverage(v1));
        assertFalse(fragment.isWhole());
    }

    @Test
    void rangeTakesSiblingsBetween() {
        Fragment fragment = extractor.extract(order, v1, v2, TransclusionRef.Mode.EXTERNAL);
        assertEquals(List.of(v1, v2), fragment.getTopLevel());
        assertEquals(Fragment.Coverage.PARTIAL, fragment.coverage(chapter));
        assertEquals(Fragment.Coverage.NONE, fragment.coverage(v3));
    }

    @Test
    void inlineModeUnwrapsParagraphs() {
        Fragment fragment = extractor.extract(order, v1, v2, TransclusionRef.Mode.INLINE);
        assertEquals(List.of(v1.getChildren().get(0), v2.getChildren().get(0)), fragment.getTopLevel());
    }

    @Test
    void endBeforeStartIsMalformed() {
        assertThrows(MalformedRangeException.class,
            () -> extractor.extract(order, v3, v1, TransclusionRef.Mode.EXTERNAL));
    }

    @Test
    void milestoneEndsAtShallowerMilestone() {
        MilestoneNode verse1 = new MilestoneNode("verse", "1", PSALMS + "/2/1");
        MilestoneNode chapter3 = new MilestoneNode("chapter", "3", PSALMS + "/3");
        TextNode inside = new TextNode("verse text");
        TextNode outside = new TextNode("next chapter");
        ElementNode body = element("p", verse1, inside, chapter3, outside);
        DocumentOrder milestones = new DocumentOrder(new Document("p", "m", null, element("div", body)));

        Fragment fragment = extractor.extract(milestones, verse1, verse1, TransclusionRef.Mode.EXTERNAL);
        List<Node> expected = List.of(verse1, inside);
        assertEquals(expected, fragment.getTopLevel());
    }

    @Test
    void wholeDocument() {
        Fragment whole = Fragment.whole(order);
        assertTrue(whole.isWhole());
        assertEquals(Fragment.Coverage.FULL, whole.coverage(chapter));
        assertNull(order.findById("none"));
    }
}
