package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

public class EffectKeysTest {

    @Test
    public void testGrammarIsReproducedExactly() {
        assertEquals("task:t1:created", EffectKeys.created("task", "t1"));
        assertEquals("task:t1:status:Created->Done", EffectKeys.status("task", "t1", "Created", "Done"));
        assertEquals("task:t1:status:Created->Done:202405", EffectKeys.status("task", "t1", "Created", "Done", "202405"));
        assertEquals("task:t1:itemCreated", EffectKeys.sideEffect("task", "t1", "itemCreated"));
        assertEquals("player:p1:points:202405", EffectKeys.monthly("player", "p1", "points", "202405"));
        assertEquals("player:p1:points:202401", EffectKeys.monthly("player", "p1", "points", YearMonth.of(2024, 1)));
    }

    @Test
    public void testTypedOverloadsUseLowerCaseEntityKeys() {
        EntityRef ref = EntityRef.of(EntityType.FINANCIAL, "f1");
        assertEquals("financial:f1:created", EffectKeys.created(ref));
        assertEquals("financial:f1:pointsAwarded", EffectKeys.sideEffect(ref, EffectKeys.POINTS_AWARDED));
    }

    @Test
    public void testBlankPartsAndBadBucketsAreRejected() {
        assertThrows(ValidationException.class, () -> EffectKeys.created("task", " "));
        assertThrows(ValidationException.class, () -> EffectKeys.sideEffect("task", "t1", null));
        assertThrows(ValidationException.class, () -> EffectKeys.monthly("task", "t1", "k", "2024-05"));
    }
}
