package com.carsales.taskservice.task.dataset;

import com.carsales.taskservice.config.TaskServiceProperties;
import com.carsales.taskservice.task.model.CarSaleRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class CsvDatasetSource implements DatasetSource {
    private static final Logger log = LoggerFactory.getLogger(CsvDatasetSource.class);
    private static final DateTimeFormatter SALE_DATE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendPattern("[ ]['T']")
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private final Path path;

    @Autowired
    public CsvDatasetSource(TaskServiceProperties properties) {
        this(resolvePath(properties.getData().getUnifiedCsv()));
    }

    CsvDatasetSource(Path path) {
        this.path = path;
    }

    @Override
    public String location() {
        return path.toString();
    }

    @Override
    public List<CarSaleRow> load() {
        if (!Files.isRegularFile(path)) {
            throw new DatasetUnavailableException("Data file not found at " + path);
        }
        List<CarSaleRow> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                rows.add(toRow(record.toMap()));
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            throw new DatasetUnavailableException("Failed to read data file at " + path + ": " + rootMessage(e), e);
        }
        log.info("Read {} records from {}", rows.size(), path);
        return rows;
    }

    private CarSaleRow toRow(Map<String, String> values) {
        return new CarSaleRow(
            text(values, "company"),
            text(values, "name"),
            decimal(values, "mpg"),
            integer(values, "cylinders"),
            decimal(values, "displacement"),
            decimal(values, "horsepower"),
            decimal(values, "weight"),
            decimal(values, "acceleration"),
            saleDate(values),
            integer(values, "price"),
            text(values, "origin")
        );
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setAllowMissingColumnNames(true)
            .build();
        return format.parse(reader);
    }

    private String text(Map<String, String> values, String column) {
        String value = values.get(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private Double decimal(Map<String, String> values, String column) {
        String value = text(values, column);
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {} value '{}'", column, value);
            return null;
        }
    }

    private Integer integer(Map<String, String> values, String column) {
        Double value = decimal(values, column);
        if (value == null) {
            return null;
        }
        try {
            return Math.toIntExact(Math.round(value));
        } catch (ArithmeticException e) {
            log.debug("Ignoring out-of-range {} value '{}'", column, value);
            return null;
        }
    }

    private LocalDateTime saleDate(Map<String, String> values) {
        String value = text(values, "sale_date");
        if (value == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = SALE_DATE.parseBest(value, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof LocalDateTime dateTime) {
                return dateTime;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable sale_date '{}'", value);
            return null;
        }
    }

    private static Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }
}
