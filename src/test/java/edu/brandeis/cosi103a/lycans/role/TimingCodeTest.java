package edu.brandeis.cosi103a.lycans.role;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimingCodeTest {

    @Test
    void parse_validCodes() {
        assertEquals(Optional.of(new TimingCode(Phase.NIGHT, 2)), TimingCode.parse("N2"));
        assertEquals(Optional.of(new TimingCode(Phase.DAY, 3)), TimingCode.parse("J3"));
        assertEquals(Optional.of(new TimingCode(Phase.MEETING, 1)), TimingCode.parse(" M1 "));
        assertEquals(Optional.of(new TimingCode(Phase.UNKNOWN, 4)), TimingCode.parse("U4"));
    }

    @Test
    void parse_invalidCodes() {
        assertTrue(TimingCode.parse(null).isEmpty());
        assertTrue(TimingCode.parse("").isEmpty());
        assertTrue(TimingCode.parse("X1").isEmpty());
        assertTrue(TimingCode.parse("N").isEmpty());
        assertTrue(TimingCode.parse("N99999999999").isEmpty());
    }

    @Test
    void parseResolved_rejectsUnknownPhase() {
        assertTrue(TimingCode.parseResolved("U3").isEmpty());
        assertTrue(TimingCode.parseResolved("J3").isPresent());
    }

    @Test
    void ordering_numberThenPhase() {
        List<TimingCode> codes = new ArrayList<>(List.of(
            TimingCode.parse("N2").orElseThrow(),
            TimingCode.parse("M1").orElseThrow(),
            TimingCode.parse("J2").orElseThrow(),
            TimingCode.parse("N1").orElseThrow()));
        codes.sort(null);
        assertEquals(List.of("N1", "M1", "J2", "N2"), codes.stream().map(TimingCode::code).toList());
    }

    @Test
    void label_usesPhaseName() {
        assertEquals("Nuit 2", TimingCode.night(2).label());
        assertEquals("Meeting 1", TimingCode.meeting(1).label());
        assertEquals("Journée 4", TimingCode.parse("U4").orElseThrow().label());
    }

    @Test
    void progress_nightsAndMeetingsOnly() {
        assertEquals(Optional.of(2.0), TimingCode.night(2).progress());
        assertEquals(Optional.of(1.5), TimingCode.meeting(1).progress());
        assertTrue(TimingCode.parse("J2").orElseThrow().progress().isEmpty());
    }
}
