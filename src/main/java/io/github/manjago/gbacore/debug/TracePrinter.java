package io.github.manjago.gbacore.debug;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints recorded trace entries in human-readable format.
 */
public class TracePrinter {

    private final PrintStream out;
    private boolean showRegisters = true;
    private boolean compactMode = false;

    public TracePrinter() {
        this(System.out);
    }

    public TracePrinter(PrintStream out) {
        this.out = out;
    }

    public TracePrinter showRegisters(boolean show) {
        this.showRegisters = show;
        return this;
    }

    public TracePrinter compactMode(boolean compact) {
        this.compactMode = compact;
        return this;
    }

    /**
     * Print all entries.
     */
    public void printAll(List<TraceEntry> entries) {
        if (compactMode) {
            printSummary(entries);
            return;
        }
        for (TraceEntry entry : entries) {
            printEntry(entry);
        }
    }

    /**
     * Print single entry.
     */
    public void printEntry(TraceEntry entry) {
        String marker = entry.unimplemented() ? "  ; no-op" : entry.branched() ? "  ; -> " + hex(entry.nextAddress()) : "";
        out.printf("#%-6d %08X: %08X  %-28s%s%n",
            entry.step(), entry.address(), entry.word(), entry.disassembly(), marker);

        if (showRegisters) {
            int[] r = entry.registers();
            for (int row = 0; row < 4; row++) {
                out.print("        ");
                for (int col = 0; col < 4; col++) {
                    int index = row * 4 + col;
                    out.printf("R%-2d=%08X  ", index, r[index]);
                }
                out.println();
            }
            out.printf("        CPSR=%08X  VCOUNT=%d%n", entry.cpsr(), entry.scanline());
        }
    }

    /**
     * Print trace summary (one line per instruction).
     */
    public void printSummary(List<TraceEntry> entries) {
        out.println("  Step | Address  | Word     | Instruction");
        out.println("-------+----------+----------+-----------------------------");

        for (TraceEntry e : entries) {
            out.printf("%6d | %08X | %08X | %s%n", e.step(), e.address(), e.word(), e.disassembly());
        }
    }

    private static String hex(int value) {
        return String.format("0x%08X", value);
    }
}
