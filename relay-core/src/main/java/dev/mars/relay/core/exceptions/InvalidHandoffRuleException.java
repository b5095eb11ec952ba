/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.relay.core.exceptions;

/**
 * Raised when a handoff rule is rejected at registration time, typically
 * because one of its worker-type patterns is not a valid regular expression.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class InvalidHandoffRuleException extends RelayException {

    private final String ruleId;

    public InvalidHandoffRuleException(String ruleId, String message) {
        super(message);
        this.ruleId = ruleId;
    }

    public InvalidHandoffRuleException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }

    @Override
    public String getMessage() {
        return String.format("Handoff rule %s rejected: %s", ruleId, super.getMessage());
    }
}
