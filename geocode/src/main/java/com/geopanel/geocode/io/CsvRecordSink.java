/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.io;

import com.geopanel.geocode.model.Coordinates;
import com.geopanel.geocode.model.GeocodedRecord;
import com.geopanel.geocode.model.ResolutionOutcome;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes geocoded rows as CSV: the input columns in their original order,
 * followed by the derived geocoding columns. Absent values are empty cells.
 */
@Slf4j
public class CsvRecordSink implements RecordSink {

    static final List<String> GEOCODE_COLUMNS = List.of(
            "IsVirtual", "GeocodeQuery", "Latitude", "Longitude", "GeoSource", "GeoConfidence");

    private final Path file;
    private final List<String> inputColumns;
    private final CSVWriter csvWriter;
    private int written;
    private boolean closed;

    public CsvRecordSink(Path file, List<String> inputColumns) {
        this.file = file;
        this.inputColumns = List.copyOf(inputColumns);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
            this.csvWriter = new CSVWriter(writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open output file " + file, e);
        }

        List<String> header = new ArrayList<>(this.inputColumns);
        header.addAll(GEOCODE_COLUMNS);
        csvWriter.writeNext(header.toArray(String[]::new));
    }

    @Override
    public void accept(GeocodedRecord record) {
        ResolutionOutcome outcome = record.outcome();
        List<String> row = new ArrayList<>(inputColumns.size() + GEOCODE_COLUMNS.size());
        for (String column : inputColumns) {
            row.add(record.record().get(column));
        }
        row.add(Boolean.toString(record.virtual()));
        row.add(record.query());
        row.add(outcome.location().map(Coordinates::latitude).map(String::valueOf).orElse(null));
        row.add(outcome.location().map(Coordinates::longitude).map(String::valueOf).orElse(null));
        row.add(outcome.source().name());
        row.add(outcome.confidence().getLabel());
        csvWriter.writeNext(row.toArray(String[]::new));
        written++;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            csvWriter.close();
            log.info("Wrote {} geocoded records to {}", written, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to close output file " + file, e);
        }
    }
}
