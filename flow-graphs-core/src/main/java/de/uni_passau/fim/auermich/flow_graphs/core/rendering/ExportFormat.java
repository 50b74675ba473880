package de.uni_passau.fim.auermich.flow_graphs.core.rendering;

import java.util.Optional;

/**
 * Describes the formats a graph can be exported to.
 */
public enum ExportFormat {

    /**
     * A graphviz DOT file.
     */
    DOT {

        @Override
        public String toString() {
            return "dot";
        }

        @Override
        public GraphRenderer getRenderer() {
            return new DotRenderer();
        }
    },

    /**
     * A JSON document including the metrics.
     */
    JSON {

        @Override
        public String toString() {
            return "json";
        }

        @Override
        public GraphRenderer getRenderer() {
            return new JsonRenderer();
        }
    },

    /**
     * A PNG image with a hierarchical layout.
     */
    PNG {

        @Override
        public String toString() {
            return "png";
        }

        @Override
        public GraphRenderer getRenderer() {
            return new ImageRenderer();
        }
    };

    public abstract GraphRenderer getRenderer();

    /**
     * Returns the file name of the exported graph, e.g. {@code graph.dot}.
     *
     * @return Returns the name of the output file.
     */
    public String getFileName() {
        return "graph." + this;
    }

    /**
     * Checks whether the given {@param input} is a valid enum.
     *
     * @param input The possible enum given as string.
     * @return Returns the given enum if present.
     */
    public static Optional<ExportFormat> fromString(String input) {

        for (ExportFormat format : ExportFormat.values()) {
            if (format.toString().equalsIgnoreCase(input)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
