package com.neorag.service.cache;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives cache entry ids from question text.
 *
 * The id is the MD5 of the normalized question (trimmed, whitespace collapsed, lower-cased).
 * Distinct questions could collide; that is accepted, the later write wins.
 */
public class QuestionIdGenerator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String generate(String question) {
        return DigestUtils.md5Hex(normalize(question));
    }

    static String normalize(String question) {
        if (question == null) {
            return "";
        }
        return WHITESPACE.matcher(question.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
