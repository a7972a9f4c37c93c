package com.example.modelaudit.audit;

import com.example.modelaudit.model.Issue;

import java.util.List;

public interface AuditCheck {

    String getName();

    List<Issue> run(AuditContext context);
}
