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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PermissionCheckerTest {

    private static CallerIdentity caller(String... permissions) {
        final var builder = CallerIdentity.builder().agentId("engagement-1");
        for (final var permission : permissions) {
            builder.permission(permission);
        }
        return builder.build();
    }

    @Test
    void testAdminHasEverything() {
        final var admin = caller("*");
        assertTrue(admin.isAdmin());
        assertTrue(PermissionChecker.permits(admin, "memory.semantic"));
        assertTrue(PermissionChecker.permits(admin, "agent.escalate"));
    }

    @Test
    void testExactMatch() {
        final var agent = caller("memory.short_term", "agent.handoff");
        assertTrue(PermissionChecker.permits(agent, "memory.short_term"));
        assertTrue(PermissionChecker.permits(agent, "agent.handoff"));
        assertFalse(PermissionChecker.permits(agent, "memory.long_term"));
        assertFalse(PermissionChecker.permits(agent, "agent.escalate"));
    }

    @Test
    void testPrefixWildcard() {
        final var agent = caller("memory.*");
        assertTrue(PermissionChecker.permits(agent, "memory.short_term"));
        assertTrue(PermissionChecker.permits(agent, "memory.episodic"));
        assertFalse(PermissionChecker.permits(agent, "agent.handoff"));
        assertFalse(agent.isAdmin());
    }

    @Test
    void testEmptyScopeAndMissingCaller() {
        assertFalse(PermissionChecker.permits(caller(), "memory.short_term"));
        assertFalse(PermissionChecker.permits(null, "memory.short_term"));
        assertThrows(PermissionDeniedError.class, () -> PermissionChecker.check(caller(), "agent.handoff"));
        assertDoesNotThrow(() -> PermissionChecker.check(caller("agent.*"), "agent.handoff"));
    }
}
