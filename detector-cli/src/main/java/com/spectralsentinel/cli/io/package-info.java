/**
 * CSV input and CSV/JSON output adapters built on Jackson.
 */
package com.spectralsentinel.cli.io;
