package io.agentkeep.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JobRunr job storage. The jobrunr-spring-boot-3-starter builds its StorageProvider from this
 * DataSource; it is kept apart from the agent state database so job bookkeeping never shares
 * its connection.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSource jobRunrDataSource(
            @Value("${jobrunr.database.url:jdbc:sqlite:./data/jobrunr.db}") String url
    ) {
        createParentDirectory(url);
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("JobRunr SQLite DataSource configured: {}", url);
        return ds;
    }

    static void createParentDirectory(String url) {
        String file = url.startsWith(SQLITE_PREFIX) ? url.substring(SQLITE_PREFIX.length()) : url;
        if (file.isBlank() || file.startsWith(":memory:") || file.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(file).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create JobRunr database directory: " + parent, e);
        }
    }
}
