package de.uni_passau.fim.auermich.flow_graphs.cli.jcommander;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import de.uni_passau.fim.auermich.flow_graphs.core.rendering.ExportFormat;

import java.io.File;

@Parameters(commandDescription = "Produces the CFG of the given source and exports it.")
public class CFGCommand {

    @Parameter(names = { "-o", "-output" }, description = "The output directory of the exported graph.")
    private File outputDir = new File(".");

    @Parameter(names = { "-format" }, description = "The export format, either dot, json or png.",
            converter = ExportFormatConverter.class)
    private ExportFormat format = ExportFormat.DOT;

    public File getOutputDir() {
        return outputDir;
    }

    public ExportFormat getFormat() {
        return format;
    }
}
