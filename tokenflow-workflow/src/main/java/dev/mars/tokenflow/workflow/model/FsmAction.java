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

package dev.mars.tokenflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Action run when a state is entered or left.
 * <ul>
 *   <li>{@code emit}: sends a derived token; the value defaults to the state id</li>
 *   <li>{@code log}: records {@code message} in the activity log</li>
 * </ul>
 */
public record FsmAction(String type, Object value, String message) {

    public static final String EMIT = "emit";
    public static final String LOG = "log";

    @JsonIgnore
    public boolean isEmit() {
        return EMIT.equals(type);
    }

    @JsonIgnore
    public boolean isLog() {
        return LOG.equals(type);
    }
}
