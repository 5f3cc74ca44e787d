/**
 * Command-line runner: argument parsing, run configuration and the
 * {@link com.spectralsentinel.cli.SpectralSentinelCli} entry point.
 */
package com.spectralsentinel.cli;
