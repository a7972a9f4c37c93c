package com.example.modelaudit.audit;

import com.example.modelaudit.model.ErrorCode;
import com.example.modelaudit.model.Issue;
import com.example.modelaudit.model.IssueType;
import com.example.modelaudit.model.Severity;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public final class IssueExplanations {
    public static final String RESOURCE_NAME = "issue-explanations.properties";
    static final String UNKNOWN_ERROR_CAUSE = "Unknown error type.";

    private final Properties properties;

    public IssueExplanations(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        this.properties = copy;
    }

    public static IssueExplanations getDefault() {
        return Holder.INSTANCE;
    }

    static IssueExplanations load(String resourceName) {
        try (InputStream inputStream = IssueExplanations.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Unable to find explanation file: " + resourceName);
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            return new IssueExplanations(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load explanation file: " + resourceName, e);
        }
    }

    public String why(IssueType type) {
        return properties.getProperty(type.getKey() + ".why", "");
    }

    public String cause(IssueType type, ErrorCode errorCode) {
        if (type == IssueType.CALCULATION_ERROR) {
            if (errorCode == null) {
                return "";
            }
            return properties.getProperty(type.getKey() + ".cause." + errorCode.getCode(), UNKNOWN_ERROR_CAUSE);
        }
        return properties.getProperty(type.getKey() + ".cause", "");
    }

    public String fix(IssueType type) {
        return properties.getProperty(type.getKey() + ".fix", "");
    }

    public Issue issue(Severity severity, IssueType type, String location, String detail) {
        return issue(severity, type, location, detail, null);
    }

    public Issue issue(Severity severity, IssueType type, String location, String detail, ErrorCode errorCode) {
        return new Issue(severity, type, location, detail, why(type), cause(type, errorCode), fix(type));
    }

    private static final class Holder {
        private static final IssueExplanations INSTANCE = load(RESOURCE_NAME);
    }
}
