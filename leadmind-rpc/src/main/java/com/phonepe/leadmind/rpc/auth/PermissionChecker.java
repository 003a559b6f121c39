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

package com.phonepe.leadmind.rpc.auth;

import com.phonepe.leadmind.core.errors.PermissionDeniedError;
import lombok.experimental.UtilityClass;

/**
 * Matches a required permission against a caller's scope. A scope entry grants a permission when it is {@code *},
 * equal to it, or a prefix ending in {@code *} (so {@code memory.*} covers {@code memory.short_term}).
 */
@UtilityClass
public class PermissionChecker {
    public static final String ALL = "*";

    public static boolean permits(CallerIdentity caller, String required) {
        if (caller == null) {
            return false;
        }
        for (final var granted : caller.getPermissions()) {
            if (granted.equals(ALL) || granted.equals(required)) {
                return true;
            }
            if (granted.endsWith("*") && required.startsWith(granted.substring(0, granted.length() - 1))) {
                return true;
            }
        }
        return false;
    }

    public static void check(CallerIdentity caller, String required) {
        if (!permits(caller, required)) {
            throw new PermissionDeniedError("%s does not have %s"
                                                    .formatted(caller == null ? "anonymous caller"
                                                                              : caller.getAgentId(),
                                                               required));
        }
    }
}
