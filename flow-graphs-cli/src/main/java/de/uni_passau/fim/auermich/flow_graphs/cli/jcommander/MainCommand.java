package de.uni_passau.fim.auermich.flow_graphs.cli.jcommander;

import com.beust.jcommander.Parameter;

import java.io.File;

public class MainCommand {

    @Parameter(names = { "-f", "-file"}, description = "File path to the source file we want to analyze.",
            required = true, converter = CustomFileConverter.class)
    private File sourceFile;

    @Parameter(names = { "-d", "-debug" }, description = "Debug mode.")
    private boolean debug = false;

    @Parameter(names = { "-h", "--help" }, help = true)
    private boolean help;

    @Parameter(names = { "-l", "-lookup"}, description = "The identifier of a vertex, e.g. node_3.")
    private String vertex;

    public String getVertex() {
        return vertex;
    }

    public boolean lookup() {
        return vertex != null;
    }

    public File getSourceFile() {
        return sourceFile;
    }

    public boolean isDebug() {
        return debug;
    }

    public boolean isHelp() {
        return help;
    }
}
