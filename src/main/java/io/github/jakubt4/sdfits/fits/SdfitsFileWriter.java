package io.github.jakubt4.sdfits.fits;

import io.github.jakubt4.sdfits.error.SdfitsException;
import io.github.jakubt4.sdfits.table.AssembledTable;
import io.github.jakubt4.sdfits.table.HeaderEntry;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;
import nom.tam.util.BufferedDataOutputStream;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Encodes a primary HDU followed by binary-table extensions into a FITS file.
 *
 * <p>The file is first written next to the target under a hidden temporary name and moved
 * into place once complete, so a failed write never leaves a partial artifact behind.
 */
@Slf4j
@Component
public class SdfitsFileWriter {

    private static final String TEMP_SUFFIX = ".tmp";

    /**
     * @param target        artifact path; replaced if it exists
     * @param primaryHeader cards of the primary HDU
     * @param tables        extensions in file order
     * @throws UncheckedIOException on a file-system failure
     * @throws SdfitsException      if the tables cannot be encoded
     */
    public void write(final Path target, final List<HeaderEntry> primaryHeader, final List<AssembledTable> tables) {
        final var temp = target.resolveSibling("." + target.getFileName() + TEMP_SUFFIX);
        var moved = false;
        try {
            final var fits = new Fits();
            final BasicHDU<?> primary = BasicHDU.getDummyHDU();
            applyHeader(primary.getHeader(), primaryHeader);
            fits.addHDU(primary);
            for (final var table : tables) {
                fits.addHDU(toHdu(table));
            }

            try (var out = new BufferedDataOutputStream(Files.newOutputStream(temp))) {
                fits.write(out);
            }
            moveIntoPlace(temp, target);
            moved = true;
            log.info("Wrote [{}] with {} table(s)", target, tables.size());
        } catch (final FitsException e) {
            throw new SdfitsException("Cannot encode " + target + ": " + e.getMessage(), e);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    private static BinaryTableHDU toHdu(final AssembledTable table) throws FitsException {
        final var data = new BinaryTable();
        for (final var column : table.columns()) {
            data.addColumn(column.data().array());
        }
        final var hdu = new BinaryTableHDU(BinaryTableHDU.manufactureHeader(data), data);
        final var header = hdu.getHeader();
        for (var i = 0; i < table.columns().size(); i++) {
            final var definition = table.columns().get(i).definition();
            header.addValue("TTYPE" + (i + 1), definition.name(), "");
            if (definition.unit() != null) {
                header.addValue("TUNIT" + (i + 1), definition.unit(), "");
            }
        }
        applyHeader(header, table.header());
        return hdu;
    }

    private static void applyHeader(final Header header, final List<HeaderEntry> entries) throws HeaderCardException {
        for (final var entry : entries) {
            final var value = entry.value();
            if (value instanceof String text) {
                header.addValue(entry.keyword(), text, entry.comment());
            } else if (value instanceof Double number) {
                header.addValue(entry.keyword(), number.doubleValue(), entry.comment());
            } else if (value instanceof Integer number) {
                header.addValue(entry.keyword(), number.longValue(), entry.comment());
            } else if (value instanceof Boolean flag) {
                header.addValue(entry.keyword(), flag.booleanValue(), entry.comment());
            }
        }
    }

    private static void moveIntoPlace(final Path temp, final Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for [{}], replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(final Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (final IOException e) {
            log.warn("Could not remove temporary file [{}]: {}", temp, e.getMessage());
        }
    }
}
