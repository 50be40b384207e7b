package com.themis.refinery.core.engine;

import java.util.regex.Pattern;

/**
 * Strategy for one rule type.
 */
@FunctionalInterface
public interface TextTransform {

    TransformOutcome apply(String text, Pattern pattern, String replacement);
}
