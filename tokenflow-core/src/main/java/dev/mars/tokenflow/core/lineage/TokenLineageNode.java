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

package dev.mars.tokenflow.core.lineage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lineage record of one registered token. Everything except the child list is fixed at registration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public final class TokenLineageNode {

    private final String tokenId;
    private final Object value;
    private final String nodeId;
    private final String nodeName;
    private final long timestamp;
    private final String action;
    private final List<String> parentTokens;
    private final List<String> childTokens = new ArrayList<>();
    private final int depth;
    private final LineageType lineageType;
    private final long registrationOrder;

    TokenLineageNode(String tokenId, Object value, String nodeId, String nodeName, long timestamp,
                     String action, List<String> parentTokens, int depth, LineageType lineageType,
                     long registrationOrder) {
        this.tokenId = Objects.requireNonNull(tokenId, "Token id cannot be null");
        this.value = value;
        this.nodeId = nodeId;
        this.nodeName = nodeName;
        this.timestamp = timestamp;
        this.action = action;
        this.parentTokens = List.copyOf(parentTokens);
        this.depth = depth;
        this.lineageType = lineageType;
        this.registrationOrder = registrationOrder;
    }

    public String getTokenId() {
        return tokenId;
    }

    public Object getValue() {
        return value;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeName() {
        return nodeName;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getAction() {
        return action;
    }

    public List<String> getParentTokens() {
        return parentTokens;
    }

    public List<String> getChildTokens() {
        return Collections.unmodifiableList(childTokens);
    }

    public int getDepth() {
        return depth;
    }

    public LineageType getLineageType() {
        return lineageType;
    }

    long getRegistrationOrder() {
        return registrationOrder;
    }

    void addChild(String childTokenId) {
        if (!childTokens.contains(childTokenId)) {
            childTokens.add(childTokenId);
        }
    }

    @Override
    public String toString() {
        return "TokenLineageNode{" +
                "tokenId='" + tokenId + '\'' +
                ", nodeId='" + nodeId + '\'' +
                ", timestamp=" + timestamp +
                ", depth=" + depth +
                ", lineageType=" + lineageType +
                ", parents=" + parentTokens +
                '}';
    }
}
