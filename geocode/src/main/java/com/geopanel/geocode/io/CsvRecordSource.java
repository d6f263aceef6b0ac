/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.io;

import com.geopanel.geocode.model.AddressRecord;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads provider rows from a CSV file whose first line is the header.
 * Blank cells become absent values; rows with no content are skipped.
 */
@Slf4j
public class CsvRecordSource implements RecordSource {

    static final List<String> REQUIRED_COLUMNS = List.of(
            AddressRecord.PHYSICAL_ADDRESS, AddressRecord.TOWN, AddressRecord.COUNTY);

    private final Path file;
    private List<String> columns = List.of();

    public CsvRecordSource(Path file) {
        this.file = file;
    }

    @Override
    public List<AddressRecord> read() {
        if (!Files.isReadable(file)) {
            throw new RecordSourceException("Input file not found or unreadable: " + file);
        }

        List<String[]> rows;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader).build()) {
            rows = csvReader.readAll();
        } catch (IOException | CsvException e) {
            throw new RecordSourceException("Unable to read input file " + file, e);
        }

        if (rows.isEmpty()) {
            throw new RecordSourceException("Input file " + file + " has no header row");
        }

        List<String> header = Arrays.stream(rows.get(0)).map(CsvRecordSource::cleanHeader).toList();
        List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !header.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new RecordSourceException("Input file " + file + " is missing required columns " + missing);
        }
        this.columns = header;

        List<AddressRecord> records = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlankRow(row)) {
                continue;
            }
            Map<String, String> fields = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                String value = c < row.length ? row[c] : null;
                fields.put(header.get(c), value == null || value.isBlank() ? null : value);
            }
            records.add(new AddressRecord(fields));
        }

        log.info("Read {} provider records from {}", records.size(), file);
        return records;
    }

    @Override
    public List<String> getColumns() {
        return columns;
    }

    private static String cleanHeader(String column) {
        // spreadsheet exports may prefix the first header cell with a byte order mark
        String cleaned = column.startsWith("\uFEFF") ? column.substring(1) : column;
        return cleaned.trim();
    }

    private static boolean isBlankRow(String[] row) {
        return Arrays.stream(row).allMatch(v -> v == null || v.isBlank());
    }
}
