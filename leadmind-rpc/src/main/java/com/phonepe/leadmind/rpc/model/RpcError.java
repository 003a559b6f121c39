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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Error part of a response. {@code type} is an error type name, {@link #METHOD_NOT_FOUND} or {@link #INTERNAL}.
 */
@Value
@Builder
@Jacksonized
public class RpcError {
    public static final String METHOD_NOT_FOUND = "METHOD_NOT_FOUND";
    public static final String INTERNAL = "INTERNAL";

    String type;
    String message;
    boolean retryable;
}
