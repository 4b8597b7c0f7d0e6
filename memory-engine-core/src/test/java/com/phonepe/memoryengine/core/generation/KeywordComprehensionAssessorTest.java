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

package com.phonepe.memoryengine.core.generation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link KeywordComprehensionAssessor}
 */
class KeywordComprehensionAssessorTest {
    private final KeywordComprehensionAssessor assessor = new KeywordComprehensionAssessor();

    @Test
    void testConfusion() {
        assertEquals(ComprehensionSignal.CONFUSED, assessor.assess("I'm lost, can you make it simpler?"));
    }

    @Test
    void testConfusionWinsOverUnderstanding() {
        assertEquals(ComprehensionSignal.CONFUSED,
                     assessor.assess("I see the first part but I don't understand the second"));
    }

    @Test
    void testUnderstanding() {
        assertEquals(ComprehensionSignal.COMPREHENDED, assessor.assess("Got it! What about carry over days?"));
    }

    @Test
    void testLongQuestionCountsAsUnderstanding() {
        assertEquals(ComprehensionSignal.COMPREHENDED,
                     assessor.assess("So if I take leave in December does it count against next year's quota?"));
    }

    @Test
    void testNeutral() {
        assertEquals(ComprehensionSignal.NEUTRAL, assessor.assess("ok"));
        assertEquals(ComprehensionSignal.NEUTRAL, assessor.assess(null));
        assertEquals(ComprehensionSignal.NEUTRAL, assessor.assess("Why?"));
    }
}
