package com.formulasheet.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Settings under "spreadsheet.*" shared by every document the service opens.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    /** Version tag written into saved files and required when opening them. */
    private String version = "ps6";

    /** Regex every normalized cell name must match. Default is the grid A1..Z99. */
    private String cellNamePattern = "[A-Z][1-9][0-9]?";

    /** Whether cell names are upper-cased before use, so "a1" and "A1" are one cell. */
    private boolean upperCaseNames = true;

    /** Directory where .sprd files are saved and opened from. */
    private String storageDirectory = "sheets";

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getCellNamePattern() {
        return cellNamePattern;
    }

    public void setCellNamePattern(String cellNamePattern) {
        this.cellNamePattern = cellNamePattern;
    }

    public boolean isUpperCaseNames() {
        return upperCaseNames;
    }

    public void setUpperCaseNames(boolean upperCaseNames) {
        this.upperCaseNames = upperCaseNames;
    }

    public String getStorageDirectory() {
        return storageDirectory;
    }

    public void setStorageDirectory(String storageDirectory) {
        this.storageDirectory = storageDirectory;
    }

    public Predicate<String> cellNameValidator() {
        Pattern pattern = Pattern.compile(cellNamePattern);
        return name -> pattern.matcher(name).matches();
    }

    public UnaryOperator<String> cellNameNormalizer() {
        if (upperCaseNames) {
            return name -> name.toUpperCase(Locale.ROOT);
        }
        return UnaryOperator.identity();
    }
}
