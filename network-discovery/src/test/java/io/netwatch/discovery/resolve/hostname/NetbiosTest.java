package io.netwatch.discovery.resolve.hostname;

import io.netwatch.discovery.ScriptedCommandRunner;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NetbiosTest {

    private static final String NMBLOOKUP = "Looking up status of 192.168.1.30\n"
        + "\tWORKGROUP       <00> - <GROUP> B <ACTIVE>\n"
        + "\tMEDIASERVER     <00> -         B <ACTIVE>\n"
        + "\tMEDIASERVER     <20> -         B <ACTIVE>\n"
        + "\n\tMAC Address = 00-00-00-00-00-00\n";

    @Test
    void skipsGroupNames() {
        assertEquals(Optional.of("MEDIASERVER"), Netbios.parse(NMBLOOKUP));
    }

    @Test
    void noNameEntry() {
        assertTrue(Netbios.parse("No reply from 192.168.1.30").isEmpty());
    }

    @Test
    void commandDependsOnPlatform() throws Exception {
        ScriptedCommandRunner runner = ScriptedCommandRunner.returning(0, NMBLOOKUP, "");

        new Netbios(runner, Duration.ofSeconds(3), false).resolve("192.168.1.30");
        new Netbios(runner, Duration.ofSeconds(3), true).resolve("192.168.1.30");

        assertEquals(List.of("nmblookup", "-A", "192.168.1.30"), runner.getCommands().get(0));
        assertEquals(List.of("nbtstat", "-A", "192.168.1.30"), runner.getCommands().get(1));
    }
}
