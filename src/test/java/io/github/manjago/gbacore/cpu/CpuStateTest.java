package io.github.manjago.gbacore.cpu;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CpuStateTest {

    private CpuState state;

    @BeforeEach
    void setUp() {
        state = new CpuState();
    }

    @Test
    @DisplayName("Initial state: user mode, PC = 8, everything else zero")
    void initialState() {
        assertEquals(CpuState.USER_MODE, state.getCpsr());
        assertEquals(8, state.getPc());
        assertEquals(0, state.getInstructionAddress());
        for (int i = 0; i < 15; i++) {
            assertEquals(0, state.getRegister(i), "R" + i);
        }
    }

    @Test
    @DisplayName("jumpTo applies the pipeline offset")
    void jumpTo() {
        state.jumpTo(0x0800_0000);

        assertEquals(0x0800_0008, state.getPc());
        assertEquals(0x0800_0000, state.getInstructionAddress());
    }

    @Test
    @DisplayName("reset clears registers, flags and counters")
    void resetClearsEverything() {
        state.setRegister(3, 99);
        state.setCpsr(0xF000_0010);
        state.incrementExecuted();
        state.incrementUnimplemented();

        state.reset(0x0300_0000);

        assertEquals(0, state.getRegister(3));
        assertEquals(CpuState.USER_MODE, state.getCpsr());
        assertEquals(0, state.getExecuted());
        assertEquals(0, state.getUnimplemented());
        assertEquals(0x0300_0000, state.getInstructionAddress());
    }

    @Test
    @DisplayName("updateZeroNegative touches only Z and N")
    void zeroNegativeOnly() {
        state.setCpsr(CpuState.FLAG_C | CpuState.FLAG_V | CpuState.USER_MODE);

        state.updateZeroNegative(0);
        assertTrue(state.isZero());
        assertFalse(state.isNegative());

        state.updateZeroNegative(-5);
        assertFalse(state.isZero());
        assertTrue(state.isNegative());

        assertTrue(state.isCarry());
        assertTrue(state.isOverflow());
    }

    @Test
    @DisplayName("Copy is independent")
    void copyIsIndependent() {
        state.setRegister(1, 11);
        CpuState copy = new CpuState(state);

        state.setRegister(1, 22);

        assertEquals(11, copy.getRegister(1));
        assertEquals(11, new CpuState(copy).getRegister(1));
    }

    @Test
    @DisplayName("snapshotRegisters returns a copy")
    void snapshotIsCopy() {
        int[] snapshot = state.snapshotRegisters();
        snapshot[0] = 123;

        assertEquals(0, state.getRegister(0));
        assertEquals(CpuState.REGISTER_COUNT, snapshot.length);
    }
}
