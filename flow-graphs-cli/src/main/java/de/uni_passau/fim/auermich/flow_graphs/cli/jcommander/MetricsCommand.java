package de.uni_passau.fim.auermich.flow_graphs.cli.jcommander;

import com.beust.jcommander.Parameters;

@Parameters(commandDescription = "Computes the complexity metrics of the CFG of the given source.")
public class MetricsCommand {
}
