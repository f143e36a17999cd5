package org.calista.tactica.proof;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class PathLabelsTest {

    @Test
    public void nextIncrementsTrailingNumber() {
        assertEquals("p0_1", PathLabels.next("p0"));
        assertEquals("p0_2", PathLabels.next("p0_1"));
        assertEquals("p0_1_10", PathLabels.next("p0_1_9"));
    }

    @Test
    public void nextAppendsAfterNonNumericSegment() {
        assertEquals("p0_c1_1", PathLabels.next("p0_c1"));
        assertEquals("p0_cases_1", PathLabels.next("p0_cases"));
    }

    @Test
    public void derivedLabels() {
        assertEquals("p0_3", PathLabels.branch("p0", 3));
        assertEquals("p0_1_c2", PathLabels.caseLabel("p0_1", 2));
        assertEquals("p0_1_cases", PathLabels.casesLabel("p0_1"));
        assertEquals("p12", PathLabels.forNode(12));
    }
}
