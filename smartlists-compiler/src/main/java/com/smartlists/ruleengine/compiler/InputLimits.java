package com.smartlists.ruleengine.compiler;

import java.util.regex.Pattern;

/**
 * Upper bounds on list definitions accepted by the compiler.
 */
final class InputLimits {

    static final int MAX_REGEX_PATTERN_LENGTH = 1000;
    static final int MAX_STRING_VALUE_LENGTH = 2000;
    static final int MAX_FIELD_NAME_LENGTH = 100;
    static final int MAX_OPERATOR_LENGTH = 50;
    static final int MAX_EXPRESSION_SETS = 100;
    static final int MAX_EXPRESSIONS_PER_SET = 100;
    static final int MAX_MEDIA_TYPES = 50;

    static final Pattern FIELD_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private InputLimits() {
    }
}
