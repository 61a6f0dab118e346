package com.testflow.testflow_runner.service;

/**
 * @param scriptPath path of the .atoms script
 * @param outputDir  directory that receives the run directory; null means next to the script
 * @param debug      pause after every node end
 */
public record RunRequest(String scriptPath, String outputDir, boolean debug) {
}
