package me.golemcore.scraper.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Machine-readable classification of tool failures, so callers need not match
 * on error text.
 */
public enum ToolFailureKind {

    /**
     * Parameters were missing or invalid (bad URL, unknown operation, malformed
     * plan).
     */
    INVALID_INPUT,

    /**
     * The tool is disabled by configuration.
     */
    POLICY_DENIED,

    /**
     * Execution failed at runtime (driver errors, timeouts, plan generation
     * errors).
     */
    EXECUTION_FAILED
}
