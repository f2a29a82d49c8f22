package com.questrail.archon.emulator;

import com.questrail.archon.observability.ArchonCommandEvent;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.InboundCommand;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ArchonEmulator
 * =============================================================================
 * Command dispatcher of the emulated controller.
 *
 * <p>Takes one command line at a time, as received from a host, and writes the
 * reply the hardware would send:</p>
 * <ul>
 *   <li>{@code <RR} + payload on success</li>
 *   <li>{@code ?RR} + a short reason on failure</li>
 *   <li>nothing for lines not starting with {@code >} and for verbs the controller does not know</li>
 *   <li>{@code <RR:} + 1024 bytes per block for FETCH, with no reply line</li>
 * </ul>
 *
 * <p>Verbs are matched in the order the controller manual lists them. Prefix
 * verbs are tested after the exact verbs they overlap with
 * ({@code FETCHLOG} before {@code FETCH}, {@code LOADPARAMS} before
 * {@code LOADPARAM}).</p>
 *
 * <p>Thread-safe: all state lives in {@link EmulatedController}.</p>
 */
public final class ArchonEmulator
{
    /** {@code WCONFIGxxxxK=V} */
    static final int WCONFIG_MIN_LEN = 14;
    /** {@code RCONFIGxxxx} */
    static final int RCONFIG_LEN = 11;
    /** {@code FETCHaaaaaaaabbbbbbbb} */
    static final int FETCH_LEN = 21;

    private final EmulatedController controller;
    private final ArchonObservabilitySink sink;

    public ArchonEmulator(EmulatedController controller, ArchonObservabilitySink sink) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Handles one received line.
     *
     * @param line command line, with or without its line end
     * @param out  connection to answer on
     */
    public void handle(String line, EmulatorOutput out) {
        Optional<InboundCommand> parsed = InboundCommand.parse(line);
        if (parsed.isEmpty()) {
            return;
        }
        InboundCommand in = parsed.get();
        boolean quiet = ArchonVerbs.isQuiet(in.command());
        try {
            Optional<String> reply = dispatch(in, out);
            if (reply.isPresent()) {
                out.write(in.success(reply.get()));
                sink.onCommand(new ArchonCommandEvent(Instant.now(), in.ref().hex(), in.command(), reply.get(), true, quiet));
            }
        }
        catch (ArchonException e) {
            out.write(in.error(e.getMessage()));
            sink.onCommand(new ArchonCommandEvent(Instant.now(), in.ref().hex(), in.command(), e.getMessage(), false, quiet));
        }
    }

    public EmulatedController controller() {
        return controller;
    }

    /**
     * @return the success payload, or empty when nothing is to be sent
     */
    private Optional<String> dispatch(InboundCommand in, EmulatorOutput out) {
        String cmd = in.command();

        if (in.is(ArchonVerbs.SYSTEM)) {
            return Optional.of(controller.systemReport());
        }
        if (in.is(ArchonVerbs.STATUS)) {
            return Optional.of(controller.statusReport());
        }
        if (in.is(ArchonVerbs.TIMER)) {
            return Optional.of(controller.timerReport());
        }
        if (in.is(ArchonVerbs.FRAME)) {
            return Optional.of(controller.frameReport());
        }
        if (in.is(ArchonVerbs.FETCHLOG)) {
            return Optional.of("(null)");
        }
        if (in.startsWith(ArchonVerbs.LOCK)) {
            controller.lock(parseBufferNumber(cmd.substring(ArchonVerbs.LOCK.length())));
            return ack();
        }
        if (in.startsWith(ArchonVerbs.FETCH)) {
            fetch(in, out);
            return Optional.empty();
        }
        if (in.startsWith(ArchonVerbs.WCONFIG)) {
            writeConfig(cmd);
            return ack();
        }
        if (in.startsWith(ArchonVerbs.RCONFIG)) {
            if (cmd.length() != RCONFIG_LEN) {
                throw new ArchonException.Validation("expecting form RCONFIGxxxx");
            }
            int line = (int) parseHex(cmd.substring(7), "line number");
            return Optional.of(controller.readConfig(line));
        }
        if (in.is(ArchonVerbs.CLEARCONFIG)) {
            controller.clearConfig();
            return ack();
        }
        if (in.is(ArchonVerbs.POWERON)) {
            controller.powerOn();
            return ack();
        }
        if (in.is(ArchonVerbs.POWEROFF)) {
            controller.powerOff();
            return ack();
        }
        if (in.is(ArchonVerbs.APPLYALL) || in.is(ArchonVerbs.LOADTIMING) || in.is(ArchonVerbs.LOADPARAMS)) {
            return ack();
        }
        if (in.startsWith(ArchonVerbs.LOADPARAM)) {
            writeParameter(cmd.substring(ArchonVerbs.LOADPARAM.length()));
            return ack();
        }
        if (in.startsWith(ArchonVerbs.PREPPARAM)) {
            return ack();
        }
        if (in.startsWith(ArchonVerbs.FASTLOADPARAM)) {
            writeParameter(cmd.substring(ArchonVerbs.FASTLOADPARAM.length()));
            return ack();
        }
        if (in.startsWith(ArchonVerbs.FASTPREPPARAM)) {
            return ack();
        }
        if (in.is(ArchonVerbs.RESETTIMING) || in.is(ArchonVerbs.HOLDTIMING) || in.is(ArchonVerbs.RELEASETIMING)
                || in.startsWith(ArchonVerbs.APPLYMOD) || in.startsWith(ArchonVerbs.APPLYDIO)
                || in.is(ArchonVerbs.APPLYCDS) || in.is(ArchonVerbs.POLLOFF) || in.is(ArchonVerbs.POLLON)) {
            return ack();
        }

        // the controller ignores what it does not understand
        return Optional.empty();
    }

    private static Optional<String> ack() {
        return Optional.of("");
    }

    private void writeConfig(String cmd) {
        int eq = cmd.indexOf('=');
        if (cmd.length() < WCONFIG_MIN_LEN || eq < 0) {
            throw new ArchonException.Validation("expecting form WCONFIGxxxxT=T");
        }
        int line = (int) parseHex(cmd.substring(7, 11), "line number");
        if (eq <= 11) {
            throw new ArchonException.Validation("missing key in " + cmd);
        }
        controller.writeConfig(line, cmd.substring(11, eq), cmd.substring(eq + 1));
    }

    private void writeParameter(String args) {
        String[] tokens = args.trim().split("\\s+");
        if (tokens.length != 2 || tokens[0].isEmpty()) {
            throw new ArchonException.Validation("expected <Paramname> <value>");
        }
        controller.writeParameter(tokens[0], tokens[1]);
    }

    private void fetch(InboundCommand in, EmulatorOutput out) {
        String cmd = in.command();
        if (cmd.length() != FETCH_LEN) {
            throw new ArchonException.Validation("expecting form FETCHxxxxxxxxyyyyyyyy");
        }
        long address = parseHex(cmd.substring(5, 13), "address");
        long blocks = parseHex(cmd.substring(13), "block count");
        controller.checkFetch(address, blocks);

        out.stream(new FetchReply(controller, in.ref(), address, blocks));
        sink.onCommand(new ArchonCommandEvent(Instant.now(), in.ref().hex(), cmd, blocks + " blocks", true, false));
    }

    private static int parseBufferNumber(String text) {
        try {
            return Integer.parseInt(text);
        }
        catch (NumberFormatException e) {
            throw new ArchonException.Validation("invalid buffer number: " + text);
        }
    }

    private static long parseHex(String text, String what) {
        if (text.isEmpty()) {
            throw new ArchonException.Validation("missing " + what);
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                throw new ArchonException.Validation("invalid " + what + ": " + text);
            }
        }
        return Long.parseLong(text, 16);
    }
}
