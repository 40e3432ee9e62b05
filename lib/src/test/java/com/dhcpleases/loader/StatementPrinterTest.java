package com.dhcpleases.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dhcpleases.lease.DeclarationType;
import com.dhcpleases.lease.HardwareAddress;
import com.dhcpleases.lease.LeaseFlag;
import com.dhcpleases.lease.LeaseRecord;
import com.dhcpleases.lease.PeerState;
import com.dhcpleases.loader.ast.Declaration;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatementPrinterTest {

    private static final String FULL_LEASE =
            "lease 192.168.254.55 {\n"
                    + "  starts 3 2007/08/15 11:34:58;\n"
                    + "  ends 3 2007/08/15 11:44:58;\n"
                    + "  tstp 3 2007/08/15 11:49:58;\n"
                    + "  tsfp 2 2007/08/14 21:24:19;\n"
                    + "  atsfp 2 2007/08/14 21:24:19;\n"
                    + "  cltt 3 2007/08/15 11:34:58;\n"
                    + "  binding state active;\n"
                    + "  next binding state expired;\n"
                    + "  hardware ethernet 00:11:85:5d:4e:11;\n"
                    + "  uid \"\\001\\000\\021\\205]Nh\";\n"
                    + "  option agent.circuit-id \"eth0:12\";\n"
                    + "  option agent.remote-id 0:1:2:3;\n"
                    + "  set ddns-fwd-name = \"blah.example.org\";\n"
                    + "  set ddns-txt = \"31ad\";\n"
                    + "  on expiry|release { unset ddns-fwd-name; }\n"
                    + "  client-hostname \"blah\";\n"
                    + "}\n";

    private static final String FAILOVER =
            "\nfailover peer \"dhcp-peer\" state {\n"
                    + "  my state communications-interrupted at 2 2007/08/14 21:10:00;\n"
                    + "  partner state normal at 2 2007/08/14 20:51:22;\n"
                    + "  mclt 3600;\n"
                    + "}\n";

    private final StatementParser parser = new StatementParser();
    private final StatementPrinter printer = new StatementPrinter();

    @Test
    void reprintsMinimalLeaseByteForByte() throws Exception {
        String text =
                "lease 192.168.254.55 {\n"
                        + "  starts 3 2007/08/15 11:34:58;\n"
                        + "  ends 3 2007/08/15 11:44:58;\n"
                        + "}\n";

        assertEquals(text, roundTrip(text));
    }

    @Test
    void reprintsEveryLeaseStatementByteForByte() throws Exception {
        assertEquals(FULL_LEASE, roundTrip(FULL_LEASE));
    }

    @Test
    void reprintsHostWithFlagsByteForByte() throws Exception {
        String text =
                "host printer {\n"
                        + "  dynamic-bootp;\n"
                        + "  dynamic;\n"
                        + "  bootp;\n"
                        + "  reserved;\n"
                        + "  hardware ethernet 00:0a:95:9d:68:16;\n"
                        + "  fixed-address 192.168.10.200;\n"
                        + "  abandoned;\n"
                        + "  deleted;\n"
                        + "}\n";

        assertEquals(text, roundTrip(text));
    }

    @Test
    void reprintsFailoverStateWithLeadingBlankLine() throws Exception {
        assertEquals(FAILOVER, roundTrip(FAILOVER));
    }

    @Test
    void reprintsBareFailoverPeerNameByteForByte() throws Exception {
        String bare =
                "\nfailover peer dhcp-peer state {\n"
                        + "  my state communications-interrupted at 2 2007/08/14 21:10:00;\n"
                        + "  partner state normal at 2 2007/08/14 20:51:22;\n"
                        + "  mclt 3600;\n"
                        + "}\n";

        assertEquals(bare, roundTrip(bare));
        assertEquals(bare, roundTrip(roundTrip(bare)));
        assertEquals(
                "\nfailover peer dhcp-peer state {\n  mclt 3600;\n}\n",
                roundTrip("failover peer dhcp-peer state {\n  mclt 3600;\n}\n"));
    }

    @Test
    void bareAndQuotedFailoverNamesParseToTheSameName() throws Exception {
        LeaseRecord quoted = parse(FAILOVER);
        LeaseRecord bare = parse(FAILOVER.replace("\"dhcp-peer\"", "dhcp-peer"));

        assertEquals("dhcp-peer", quoted.getName());
        assertEquals("dhcp-peer", bare.getName());
        assertTrue(quoted.isQuotedName());
        assertFalse(bare.isQuotedName());
        assertEquals(FAILOVER, printer.print(bare.toBuilder().quotedName(true).build()));
    }

    @Test
    void printsCanonicalOrderRegardlessOfSourceOrder() throws Exception {
        String shuffled =
                "lease 10.0.0.4 {\n"
                        + "  client-hostname \"late\";\n"
                        + "  binding state free;\n"
                        + "  starts 1 2007/08/13 00:00:00;\n"
                        + "}\n";

        String printed = roundTrip(shuffled);

        assertEquals(
                "lease 10.0.0.4 {\n"
                        + "  starts 1 2007/08/13 00:00:00;\n"
                        + "  binding state free;\n"
                        + "  client-hostname \"late\";\n"
                        + "}\n",
                printed);
        assertEquals(printed, roundTrip(printed));
    }

    @Test
    void secondRoundTripIsStable() throws Exception {
        LeaseRecord first = parse(FULL_LEASE);
        LeaseRecord second = parse(printer.print(first));

        assertEquals(first, second);
        assertEquals(printer.print(first), printer.print(second));
    }

    @Test
    void absentFlagsAreNotPrinted() throws Exception {
        String printed = roundTrip("lease 10.0.0.7 {\n  binding state free;\n}\n");

        assertFalse(printed.contains("abandoned;"));
        assertFalse(printed.contains("deleted;"));
        assertFalse(printed.contains("dynamic;"));
    }

    @Test
    void abandonedAloneDoesNotPrintDeleted() throws Exception {
        String text = "lease 10.0.0.9 {\n  binding state abandoned;\n  abandoned;\n}\n";

        String printed = roundTrip(text);

        assertEquals(text, printed);
        assertFalse(printed.contains("deleted;"));
    }

    @Test
    void printsRecordBuiltWithoutParsing() {
        LeaseRecord record =
                LeaseRecord.builder(DeclarationType.LEASE, "192.168.1.10")
                        .starts("3 2007/08/15 11:34:58")
                        .ends("3 2007/08/15 11:44:58")
                        .hardware(new HardwareAddress("ethernet", "00:11:85:5d:4e:11"))
                        .flag(LeaseFlag.DELETED)
                        .variable("ddns-txt", "\"31ad\"")
                        .build();

        assertEquals(
                "lease 192.168.1.10 {\n"
                        + "  starts 3 2007/08/15 11:34:58;\n"
                        + "  ends 3 2007/08/15 11:44:58;\n"
                        + "  hardware ethernet 00:11:85:5d:4e:11;\n"
                        + "  deleted;\n"
                        + "  set ddns-txt = \"31ad\";\n"
                        + "}\n",
                printer.print(record));
    }

    @Test
    void skipsEmptyValues() {
        LeaseRecord record =
                LeaseRecord.builder(DeclarationType.FAILOVER_STATE, "peer")
                        .mclt("")
                        .myState(new PeerState("normal", "2 2007/08/14 20:51:22"))
                        .build();

        String printed = printer.print(record);

        assertTrue(printed.startsWith("\nfailover peer \"peer\" state {\n"));
        assertFalse(printed.contains("mclt"));
    }

    private String roundTrip(String text) throws Exception {
        return printer.print(parse(text));
    }

    private LeaseRecord parse(String text) throws Exception {
        List<Declaration> declarations = new DeclarationScanner().scan("test", List.of(text.split("\n")));
        assertEquals(1, declarations.size());
        return parser.parse(declarations.get(0));
    }
}
