/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.evaluation;

import java.io.IOException;
import java.util.Map;

/**
 * Carries one evaluation request to the external quality evaluator and
 * returns its raw textual answer.
 */
@FunctionalInterface
public interface EvaluationTransport {

    String send(String beforeText, String afterText, Map<String, Object> metadata) throws IOException;
}
