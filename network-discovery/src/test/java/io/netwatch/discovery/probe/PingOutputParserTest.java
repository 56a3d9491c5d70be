package io.netwatch.discovery.probe;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PingOutputParserTest {

    @Test
    void linuxReply() {
        String output = "PING 192.168.1.1 (192.168.1.1) 56(84) bytes of data.\n"
            + "64 bytes from 192.168.1.1: icmp_seq=1 ttl=64 time=3.62 ms\n\n"
            + "--- 192.168.1.1 ping statistics ---\n"
            + "1 packets transmitted, 1 received, 0% packet loss, time 0ms\n";

        assertEquals(4, PingOutputParser.parseLatency(output));
    }

    @Test
    void subMillisecondRoundsToZero() {
        assertEquals(0, PingOutputParser.parseLatency("64 bytes from 10.0.0.1: icmp_seq=1 ttl=64 time=0.123 ms"));
    }

    @Test
    void windowsReplies() {
        assertEquals(12, PingOutputParser.parseLatency("Reply from 192.168.1.1: bytes=32 time=12ms TTL=64"));
        assertEquals(1, PingOutputParser.parseLatency("Reply from 192.168.1.1: bytes=32 time<1ms TTL=64"));
    }

    @Test
    void noReply() {
        assertNull(PingOutputParser.parseLatency(
            "1 packets transmitted, 0 received, 100% packet loss, time 0ms"));
        assertNull(PingOutputParser.parseLatency("Request timed out."));
        assertNull(PingOutputParser.parseLatency(""));
        assertNull(PingOutputParser.parseLatency(null));
    }
}
