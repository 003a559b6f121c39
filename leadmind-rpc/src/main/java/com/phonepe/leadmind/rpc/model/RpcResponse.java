/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.leadmind.rpc.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Exactly one of {@code result} and {@code error} is set
 */
@Value
@Builder
@Jacksonized
public class RpcResponse {
    String requestId;
    JsonNode result;
    RpcError error;

    public static RpcResponse success(String requestId, JsonNode result) {
        return RpcResponse.builder()
                .requestId(requestId)
                .result(result)
                .build();
    }

    public static RpcResponse failure(String requestId, RpcError error) {
        return RpcResponse.builder()
                .requestId(requestId)
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
