/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import com.argus.validation.api.model.Submission;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {field}} tokens in a rule parameter with values from the submission,
 * so {@code "users.email,id,{id}"} becomes {@code "users.email,id,5"} on an update form.
 *
 * Runs before a rule is invoked. A token whose field is absent, null or not a scalar
 * is left as-is, and the persistence rules then read it as "no filter".
 */
public final class PlaceholderResolver {

    private static final Pattern TOKEN = Pattern.compile("\\{(\\w+)\\}");

    private PlaceholderResolver() {
    }

    public static String resolve(String parameter, Submission data) {
        if (parameter == null || data == null || data.isEmpty() || parameter.indexOf('{') < 0) {
            return parameter;
        }
        Matcher matcher = TOKEN.matcher(parameter);
        return matcher.replaceAll(match -> {
            Object value = data.get(match.group(1));
            if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
                return Matcher.quoteReplacement(value.toString());
            }
            return Matcher.quoteReplacement(match.group());
        });
    }

    public static boolean hasUnresolved(String parameter) {
        return parameter != null && TOKEN.matcher(parameter).find();
    }
}
