// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import sh.tessera.core.abi.RevertDecoder;

/**
 * Revert data that was classified by {@link RevertDecoder}.
 */
public final class RevertException extends TesseraException {

    private final RevertDecoder.RevertKind kind;
    private final String revertReason;
    private final String rawDataHex;

    public RevertException(
            final RevertDecoder.RevertKind kind, final String revertReason, final String rawDataHex) {
        super(messageFor(kind, revertReason, rawDataHex));
        this.kind = kind;
        this.revertReason = revertReason;
        this.rawDataHex = rawDataHex;
    }

    private static String messageFor(final RevertDecoder.RevertKind kind, final String reason, final String raw) {
        final String suffix = kind != null && kind != RevertDecoder.RevertKind.UNKNOWN ? " [" + kind + "]" : "";
        return reason != null
                ? "EVM revert" + suffix + ": " + reason
                : "EVM revert" + suffix + " (no reason), rawData=" + raw;
    }

    public RevertDecoder.RevertKind kind() {
        return kind;
    }

    public String revertReason() {
        return revertReason;
    }

    public String rawDataHex() {
        return rawDataHex;
    }
}
