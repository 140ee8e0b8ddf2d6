package com.entigraph.service.core.model.config;

/** One identifier fragment: a literal {@code value}, an {@code attribute} reference or an {@code alias}. */
public record FragmentConfig(String value, String attribute, String alias) {

    public static FragmentConfig value(String value) {
        return new FragmentConfig(value, null, null);
    }

    public static FragmentConfig attribute(String attribute) {
        return new FragmentConfig(null, attribute, null);
    }

    public static FragmentConfig alias(String alias) {
        return new FragmentConfig(null, null, alias);
    }
}
