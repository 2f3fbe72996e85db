package com.opensiddur.pipeline;

import com.opensiddur.errors.UnbalancedScopeException;
import com.opensiddur.errors.UnmatchedConditionalException;
import com.opensiddur.models.ConditionalBlock;
import com.opensiddur.models.DeclareBlock;
import com.opensiddur.models.Document;
import com.opensiddur.models.EndConditional;
import com.opensiddur.models.EndDeclare;
import com.opensiddur.models.FeatureValue;
import com.opensiddur.models.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.opensiddur.pipeline.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

class ScaffoldingValidatorTest {

    private final ScaffoldingValidator validator = new ScaffoldingValidator();

    private static DocumentOrder order(Node... body) {
        return new DocumentOrder(new Document("siddur", "checked", null, element("div", body)));
    }

    private static DeclareBlock declare(String id) {
        return new DeclareBlock(id, List.of(rite("nusach", FeatureValue.ofString("ashkenaz"))));
    }

    @Test
    void balancedDocumentPasses() {
        assertDoesNotThrow(() -> validator.validate(order(
            declare("a"), element("p", declare("b")), new EndDeclare("a"),
            new ConditionalBlock("c", null, null), element("p", new EndDeclare("b")), new EndConditional("c"))));
    }

    @Test
    void duplicateDeclareId() {
        UnbalancedScopeException e = assertThrows(UnbalancedScopeException.class, () -> validator.validate(order(
            declare("a"), new EndDeclare("a"), declare("a"), new EndDeclare("a"))));
        assertEquals("/div[1]/declare[2]", e.getNodePath());
        assertEquals("checked", e.getDocument());
    }

    @Test
    void declareEndedTwice() {
        assertThrows(UnbalancedScopeException.class, () -> validator.validate(order(
            declare("a"), new EndDeclare("a"), new EndDeclare("a"))));
    }

    @Test
    void endBeforeConditional() {
        assertThrows(UnmatchedConditionalException.class, () -> validator.validate(order(
            new EndConditional("c"), new ConditionalBlock("c", null, null))));
    }

    @Test
    void conditionalWithoutId() {
        assertThrows(UnmatchedConditionalException.class, () -> validator.validate(order(
            new ConditionalBlock(null, null, null), new EndConditional(null))));
    }
}
