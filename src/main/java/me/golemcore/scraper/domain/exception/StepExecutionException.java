package me.golemcore.scraper.domain.exception;

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
 * Failure of a single plan step. Critical failures abort the remaining steps
 * of the page; recoverable ones are recorded and execution continues.
 */
public class StepExecutionException extends ScraperException {

    private static final long serialVersionUID = 1L;

    private final int stepIndex;
    private final String action;
    private final boolean critical;

    public StepExecutionException(int stepIndex, String action, boolean critical, String message, Throwable cause) {
        super(message, cause);
        this.stepIndex = stepIndex;
        this.action = action;
        this.critical = critical;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getAction() {
        return action;
    }

    public boolean isCritical() {
        return critical;
    }
}
