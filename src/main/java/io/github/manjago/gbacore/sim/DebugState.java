package io.github.manjago.gbacore.sim;

/**
 * Point-in-time view of the machine for diagnostics.
 *
 * @param pc address of the next instruction to execute
 * @param cpsr status register
 * @param vcount current scanline
 * @param frame V-blanks since the last load
 * @param instructions instructions executed since the last load
 */
public record DebugState(int pc, int cpsr, int vcount, long frame, long instructions) {

    @Override
    public String toString() {
        return String.format("PC=0x%08X CPSR=0x%08X VCOUNT=%d frame=%d instructions=%,d",
                pc, cpsr, vcount, frame, instructions);
    }
}
