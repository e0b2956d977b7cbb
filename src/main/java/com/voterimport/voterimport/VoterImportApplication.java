package com.voterimport.voterimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Each command opens the SQLite database it is pointed at, so no application-wide DataSource is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class VoterImportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(VoterImportApplication.class, args)));
    }
}
