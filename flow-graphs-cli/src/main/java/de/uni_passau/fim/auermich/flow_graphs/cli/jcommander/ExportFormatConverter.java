package de.uni_passau.fim.auermich.flow_graphs.cli.jcommander;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import de.uni_passau.fim.auermich.flow_graphs.core.rendering.ExportFormat;

import java.util.Optional;

/**
 * Converts an export format to it's internal representation.
 */
public class ExportFormatConverter implements IStringConverter<ExportFormat> {

    /**
     * Converts a string defining an export format to its equivalent enum representation.
     *
     * @param value The input defining an export format, e.g. dot.
     * @return Returns the enum representation of the given export format.
     */
    @Override
    public ExportFormat convert(String value) {
        Optional<ExportFormat> format = ExportFormat.fromString(value);

        if (format.isEmpty()) {
            throw new ParameterException("Value " + value + " is not a valid export format.");
        } else {
            return format.get();
        }
    }
}
