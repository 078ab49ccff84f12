package com.questrail.homeshadow.core;

import com.questrail.homeshadow.api.EntityKind;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.UnitOfMeasure;
import com.questrail.homeshadow.core.ControlDispatchTable.ControlEffect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControlDispatchTableTest {

    private final ControlDispatchTable table = ControlDispatchTable.standard();

    @Test
    void transientCommandsOnlyNotify() {
        assertEquals(ControlEffect.NOTIFY_ONLY, table.resolve(EntityKind.NODE, "DON", true));
        assertEquals(ControlEffect.NOTIFY_ONLY, table.resolve(EntityKind.PROGRAM, "RUNTHEN", true));
    }

    @Test
    void reportedCodesAreStoredWhereTheKindAllows() {
        assertEquals(ControlEffect.AUX_PROPERTY, table.resolve(EntityKind.NODE, "CLITEMP", true));
        assertEquals(ControlEffect.NOTIFY_ONLY, table.resolve(EntityKind.GROUP, "OL", true));
        assertEquals(ControlEffect.UNSUPPORTED, table.resolve(EntityKind.VARIABLE, "OL", true));
    }

    @Test
    void batteryLevelIsStatusOnlyUntilStatusIsKnown() {
        assertEquals(ControlEffect.STATUS, table.resolve(EntityKind.NODE, "BATLVL", false));
        assertEquals(ControlEffect.AUX_PROPERTY, table.resolve(EntityKind.NODE, "BATLVL", true));
    }

    @Test
    void rampRateAlreadyInSecondsIsLeftAlone() {
        PropertyValue seconds = PropertyValue.of(20, 1, UnitOfMeasure.SECONDS, "2.0 sec");
        assertSame(seconds, table.normalize("RR", seconds));

        PropertyValue index = PropertyValue.of(0);
        assertEquals("540.0", table.normalize("RR", index).decimalText());
    }

    @Test
    void rampRateOutsideTheIndexRangeIsLeftAlone() {
        // would alias index 28 if narrowed to an int
        PropertyValue huge = PropertyValue.of((1L << 32) + 28);
        assertSame(huge, table.normalize("RR", huge));

        PropertyValue negative = PropertyValue.of(-1);
        assertSame(negative, table.normalize("RR", negative));

        PropertyValue scaled = PropertyValue.of(28, 1, UnitOfMeasure.NOT_SET, "");
        assertSame(scaled, table.normalize("RR", scaled));
    }
}
