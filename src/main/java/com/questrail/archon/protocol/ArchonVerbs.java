package com.questrail.archon.protocol;

import java.util.Set;

/**
 * ArchonVerbs
 * -----------------------------------------------------------------------------
 * Command verbs and fixed constants of the Archon text protocol.
 *
 * <p>Verbs are listed in the order the controller manual presents them.
 * Verbs that carry arguments are prefixes; the argument text follows the verb
 * with no separator unless noted.</p>
 */
public final class ArchonVerbs
{
    private ArchonVerbs() {}

    public static final String SYSTEM = "SYSTEM";
    public static final String STATUS = "STATUS";
    public static final String TIMER = "TIMER";
    public static final String FRAME = "FRAME";
    public static final String FETCHLOG = "FETCHLOG";
    public static final String LOCK = "LOCK";
    public static final String FETCH = "FETCH";
    public static final String WCONFIG = "WCONFIG";
    public static final String RCONFIG = "RCONFIG";
    public static final String CLEARCONFIG = "CLEARCONFIG";
    public static final String APPLYALL = "APPLYALL";
    public static final String POWERON = "POWERON";
    public static final String POWEROFF = "POWEROFF";
    public static final String LOADTIMING = "LOADTIMING";
    public static final String LOADPARAMS = "LOADPARAMS";
    /** {@code LOADPARAM name value} (space separated). */
    public static final String LOADPARAM = "LOADPARAM";
    public static final String PREPPARAM = "PREPPARAM";
    /** {@code FASTLOADPARAM name value} (space separated). */
    public static final String FASTLOADPARAM = "FASTLOADPARAM";
    public static final String FASTPREPPARAM = "FASTPREPPARAM";
    public static final String RESETTIMING = "RESETTIMING";
    public static final String HOLDTIMING = "HOLDTIMING";
    public static final String RELEASETIMING = "RELEASETIMING";
    public static final String APPLYMOD = "APPLYMOD";
    public static final String APPLYDIO = "APPLYDIO";
    public static final String APPLYCDS = "APPLYCDS";
    public static final String POLLOFF = "POLLOFF";
    public static final String POLLON = "POLLON";

    /** Releases any locked frame buffer. */
    public static final String UNLOCK = LOCK + "0";

    /** Bytes per FETCH block. */
    public static final int BLOCK_LEN = 1024;

    /** Length of the {@code <RR:} header preceding every FETCH block. */
    public static final int BLOCK_HEADER_LEN = 4;

    /**
     * Verbs polled at high frequency. They are logged at a lower level so the
     * log is not flooded during exposures.
     */
    private static final Set<String> QUIET = Set.of(STATUS, TIMER, FRAME, WCONFIG);

    /**
     * Returns {@code true} when the command should be kept out of verbose logging.
     */
    public static boolean isQuiet(String command) {
        for (String verb : QUIET) {
            if (command.startsWith(verb)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} for commands answered with binary blocks instead of a reply line.
     * {@code FETCHLOG} is an ordinary text command despite the shared prefix.
     */
    public static boolean isBulk(String command) {
        return command.startsWith(FETCH) && !command.startsWith(FETCHLOG);
    }
}
