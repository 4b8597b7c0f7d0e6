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

package com.phonepe.memoryengine.core.model;

import java.util.Comparator;

/**
 * The four authority levels memory is sourced from. Declaration order is the authority order: an earlier constant
 * dominates every later one.
 */
public enum Realm {
    /**
     * Policies and knowledge owned by the client. Always wins.
     */
    CLIENT,
    /**
     * Memory of the individual actor. The only realm written to by consolidation.
     */
    ACTOR,
    /**
     * Memory shared by every actor of a class
     */
    ACTOR_CLASS,
    /**
     * Knowledge packaged in skill modules an actor subscribes to
     */
    SKILL_MODULE;

    /**
     * Sorts realms from highest to lowest authority
     */
    public static final Comparator<Realm> BY_AUTHORITY = Comparator.naturalOrder();

    public boolean outranks(final Realm other) {
        return compareTo(other) < 0;
    }

    public static Realm highest(final Realm lhs, final Realm rhs) {
        return lhs.outranks(rhs) ? lhs : rhs;
    }
}
