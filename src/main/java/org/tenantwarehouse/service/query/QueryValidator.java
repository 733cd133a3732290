package org.tenantwarehouse.service.query;

import org.tenantwarehouse.models.dto.QueryValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Static checks over caller-supplied SQL. Security issues make a statement invalid; warnings never do.
 */
@Component
public class QueryValidator {

    private record Check(Pattern pattern, String message) {
    }

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final List<Check> SECURITY_CHECKS = List.of(
            new Check(Pattern.compile(";\\s*(drop|delete|truncate|alter|create|insert|update)\\s+", FLAGS),
                    "Potentially dangerous SQL operation detected"),
            new Check(Pattern.compile(";\\s*\\S", FLAGS), "Multiple statements detected"),
            new Check(Pattern.compile("union\\s+(all\\s+)?select", FLAGS), "UNION SELECT detected - potential SQL injection"),
            new Check(Pattern.compile("--"), "SQL comments detected"),
            new Check(Pattern.compile("/\\*"), "SQL block comments detected"),
            new Check(Pattern.compile("xp_cmdshell", FLAGS), "System command execution detected"),
            new Check(Pattern.compile("sp_executesql", FLAGS), "Dynamic SQL execution detected"),
            new Check(Pattern.compile("\\bpg_sleep\\s*\\(", FLAGS), "Sleep function detected"));

    private static final Pattern SELECT_FROM = Pattern.compile("\\b(select|with)\\b.*\\bfrom\\b", FLAGS);
    private static final Pattern SELECT_STAR = Pattern.compile("\\bselect\\s+\\*", FLAGS);
    private static final Pattern WHERE_ONE_EQUALS_ONE = Pattern.compile("\\bwhere\\s+1\\s*=\\s*1\\b", FLAGS);
    private static final Pattern LEADING_WILDCARD = Pattern.compile("\\blike\\s+'%", FLAGS);
    private static final Pattern WHERE = Pattern.compile("\\bwhere\\b", FLAGS);
    private static final Pattern ORDER_BY = Pattern.compile("\\border\\s+by\\b", FLAGS);
    private static final Pattern LIMIT = Pattern.compile("\\blimit\\b", FLAGS);

    public QueryValidationResult validate(String sql) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> securityIssues = new ArrayList<>();
        if (sql == null || sql.isBlank()) {
            errors.add("Query is empty");
            return new QueryValidationResult(false, errors, warnings, securityIssues);
        }

        // A single trailing semicolon is harmless.
        String statement = sql.strip();
        if (statement.endsWith(";")) {
            statement = statement.substring(0, statement.length() - 1);
        }

        for (Check check : SECURITY_CHECKS) {
            if (check.pattern().matcher(statement).find()) {
                securityIssues.add(check.message());
            }
        }

        if (!SELECT_FROM.matcher(statement).find()) {
            errors.add("Query must have SELECT and FROM clauses");
        }
        if (SELECT_STAR.matcher(statement).find()) {
            warnings.add("Consider specifying columns instead of SELECT *");
        }
        if (WHERE_ONE_EQUALS_ONE.matcher(statement).find()) {
            warnings.add("Avoid WHERE 1=1 conditions");
        }
        if (LEADING_WILDCARD.matcher(statement).find()) {
            warnings.add("Leading wildcard in LIKE may cause performance issues");
        }
        if (!WHERE.matcher(statement).find()) {
            warnings.add("Query without WHERE clause may return too many rows");
        }
        if (ORDER_BY.matcher(statement).find() && !LIMIT.matcher(statement).find()) {
            warnings.add("ORDER BY without LIMIT may cause performance issues");
        }

        boolean valid = errors.isEmpty() && securityIssues.isEmpty();
        return new QueryValidationResult(valid, List.copyOf(errors), List.copyOf(warnings), List.copyOf(securityIssues));
    }
}
