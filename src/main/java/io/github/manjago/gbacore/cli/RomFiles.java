package io.github.manjago.gbacore.cli;

import io.github.manjago.gbacore.sim.InvalidRomException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads cartridge and BIOS images from disk.
 * 
 * ROMs may be raw ({@code .gba}, {@code .bin}) or zipped ({@code .zip}, the
 * first {@code .gba} entry is used). Anything else is refused.
 */
public final class RomFiles {

    /** Exit code for files that exist but are not a usable ROM */
    public static final int EXIT_UNSUPPORTED = 2;

    /** Exit code for file-system failures */
    public static final int EXIT_IO_ERROR = 1;

    private RomFiles() {
        // Utility class
    }

    /**
     * Load a cartridge image.
     *
     * @throws InvalidRomException if the file type is not supported or a zip holds no .gba entry
     * @throws IOException if the file cannot be read
     */
    public static byte[] loadRom(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".gba") || name.endsWith(".bin")) {
            return Files.readAllBytes(file);
        }
        if (name.endsWith(".zip")) {
            return firstGbaEntry(file);
        }
        throw new InvalidRomException("Unsupported ROM file type: " + file.getFileName()
                + " (expected .gba, .bin or .zip)");
    }

    /**
     * Load a BIOS image as-is.
     */
    public static byte[] loadBios(Path file) throws IOException {
        return Files.readAllBytes(file);
    }

    private static byte[] firstGbaEntry(Path zip) throws IOException {
        try (InputStream in = Files.newInputStream(zip);
             ZipInputStream zin = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".gba")) {
                    return zin.readAllBytes();
                }
            }
        }
        throw new InvalidRomException("No .gba entry in " + zip.getFileName());
    }
}
