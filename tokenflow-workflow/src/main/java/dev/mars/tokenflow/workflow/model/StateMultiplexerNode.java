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

import java.util.ArrayList;
import java.util.List;

/**
 * Routes each incoming token to the first route whose condition holds, or to the default route.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public record StateMultiplexerNode(
        String nodeId,
        String displayName,
        List<MultiplexerRoute> routes,
        MultiplexerRoute defaultRoute) implements NodeDefinition {

    public StateMultiplexerNode {
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.STATE_MULTIPLEXER;
    }

    @Override
    public List<String> destinationNodeIds() {
        List<String> ids = new ArrayList<>();
        for (MultiplexerRoute route : routes) {
            if (route.destinationNodeId() != null && !ids.contains(route.destinationNodeId())) {
                ids.add(route.destinationNodeId());
            }
        }
        if (defaultRoute != null && defaultRoute.destinationNodeId() != null
                && !ids.contains(defaultRoute.destinationNodeId())) {
            ids.add(defaultRoute.destinationNodeId());
        }
        return ids;
    }
}
