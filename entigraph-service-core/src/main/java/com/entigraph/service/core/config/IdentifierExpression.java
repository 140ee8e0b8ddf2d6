package com.entigraph.service.core.config;

import java.util.List;

/**
 * Materialized identifier expression. Templates are parsed into fragments at load time, so the
 * resolver only ever deals with attribute references and literals.
 */
public interface IdentifierExpression {

    /** Attribute names this expression reads, in order. */
    List<String> attributes();

    /** Direct attribute reference. */
    record Attribute(String name) implements IdentifierExpression {
        @Override
        public List<String> attributes() {
            return List.of(name);
        }
    }

    /** {@code "{{accountId}}:{{region}}:{{clusterName}}"} style composite. */
    record Template(String source, List<Fragment> parts) implements IdentifierExpression {
        public Template {
            parts = List.copyOf(parts);
        }

        @Override
        public List<String> attributes() {
            return Fragment.attributesOf(parts);
        }
    }

    /** Ordered concatenation of literals and attribute references. */
    record Fragments(List<Fragment> parts) implements IdentifierExpression {
        public Fragments {
            parts = List.copyOf(parts);
        }

        @Override
        public List<String> attributes() {
            return Fragment.attributesOf(parts);
        }
    }

    /** Either a literal or an attribute reference, never both. */
    record Fragment(String literal, String attribute) {

        public static Fragment literal(String value) {
            return new Fragment(value, null);
        }

        public static Fragment attribute(String name) {
            return new Fragment(null, name);
        }

        public boolean isLiteral() {
            return attribute == null;
        }

        static List<String> attributesOf(List<Fragment> parts) {
            return parts.stream()
                    .filter(p -> !p.isLiteral())
                    .map(Fragment::attribute)
                    .toList();
        }
    }
}
