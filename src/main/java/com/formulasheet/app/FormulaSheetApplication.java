package com.formulasheet.app;

import com.formulasheet.app.config.SpreadsheetProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SpreadsheetProperties.class)
public class FormulaSheetApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaSheetApplication.class, args);
    }
}
