package com.opensiddur.pipeline;

import com.opensiddur.errors.UnbalancedScopeException;
import com.opensiddur.errors.UnmatchedConditionalException;
import com.opensiddur.models.ConditionalBlock;
import com.opensiddur.models.Document;
import com.opensiddur.models.DeclareBlock;
import com.opensiddur.models.EndConditional;
import com.opensiddur.models.EndDeclare;
import com.opensiddur.models.Node;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Checks, before a document is traversed, that every declare and conditional has exactly one
 * end with its id later in the same document and that ids are not reused.
 */
public class ScaffoldingValidator {

    public void validate(DocumentOrder order) {
        Document document = order.getDocument();
        Map<String, Node> declares = new HashMap<>();
        Map<String, Node> conditionals = new HashMap<>();
        Set<String> endedDeclares = new HashSet<>();
        Set<String> endedConditionals = new HashSet<>();

        for (int i = 0; i < order.size(); i++) {
            Node node = order.nodeAt(i);
            String path = order.path(node);
            if (node instanceof DeclareBlock) {
                String id = ((DeclareBlock) node).getId();
                if (id == null || id.isBlank()) {
                    throw new UnbalancedScopeException("declare without id",
                        document.getProject(), document.getPath(), path);
                }
                if (declares.put(id, node) != null) {
                    throw new UnbalancedScopeException("declare id '" + id + "' used twice",
                        document.getProject(), document.getPath(), path);
                }
            } else if (node instanceof EndDeclare) {
                String target = ((EndDeclare) node).getTarget();
                if (!declares.containsKey(target)) {
                    throw new UnbalancedScopeException("end of declare '" + target + "' without an earlier declare",
                        document.getProject(), document.getPath(), path);
                }
                if (!endedDeclares.add(target)) {
                    throw new UnbalancedScopeException("declare '" + target + "' ended twice",
                        document.getProject(), document.getPath(), path);
                }
            } else if (node instanceof ConditionalBlock) {
                String id = ((ConditionalBlock) node).getId();
                if (id == null || id.isBlank()) {
                    throw new UnmatchedConditionalException("conditional without id",
                        document.getProject(), document.getPath(), path);
                }
                if (conditionals.put(id, node) != null) {
                    throw new UnmatchedConditionalException("conditional id '" + id + "' used twice",
                        document.getProject(), document.getPath(), path);
                }
            } else if (node instanceof EndConditional) {
                String target = ((EndConditional) node).getTarget();
                if (!conditionals.containsKey(target)) {
                    throw new UnmatchedConditionalException("end of conditional '" + target
                        + "' without an earlier conditional", document.getProject(), document.getPath(), path);
                }
                if (!endedConditionals.add(target)) {
                    throw new UnmatchedConditionalException("conditional '" + target + "' ended twice",
                        document.getProject(), document.getPath(), path);
                }
            }
        }

        for (Map.Entry<String, Node> declare : declares.entrySet()) {
            if (!endedDeclares.contains(declare.getKey())) {
                throw new UnbalancedScopeException("declare '" + declare.getKey() + "' is never ended",
                    document.getProject(), document.getPath(), order.path(declare.getValue()));
            }
        }
        for (Map.Entry<String, Node> conditional : conditionals.entrySet()) {
            if (!endedConditionals.contains(conditional.getKey())) {
                throw new UnmatchedConditionalException("conditional '" + conditional.getKey() + "' is never ended",
                    document.getProject(), document.getPath(), order.path(conditional.getValue()));
            }
        }
    }
}
