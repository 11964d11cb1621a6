package org.carball.rlsguard.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rlsguard.model.ast.ColumnNode;
import org.carball.rlsguard.model.ast.ComparisonNode;
import org.carball.rlsguard.model.ast.FunctionNode;
import org.carball.rlsguard.model.ast.JoinClause;
import org.carball.rlsguard.model.ast.LiteralNode;
import org.carball.rlsguard.model.ast.LogicalNode;
import org.carball.rlsguard.model.ast.PolicyConditionNode;
import org.carball.rlsguard.model.ast.PolicyNodeVisitor;
import org.carball.rlsguard.model.ast.PolicyTrees;
import org.carball.rlsguard.model.ast.SubqueryNode;
import org.carball.rlsguard.model.policy.DependencyType;
import org.carball.rlsguard.model.policy.PolicyDependency;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects what a policy expression refers to. The tree walk finds columns, functions and
 * the tables read by subqueries; a second pass over the raw text finds session and role
 * references the tree does not model. Results are unique per (type, name), in order of
 * first appearance.
 */
@Slf4j
public class DependencyAnalyzer {

    public static final Set<String> SECURITY_FUNCTIONS = Set.of(
            "auth.uid", "auth.role", "current_user", "session_user", "current_role",
            "current_setting", "pg_has_role", "has_table_privilege", "has_column_privilege"
    );

    private static final String AUTH_UID_CALL = "auth.uid()";
    private static final Pattern ROLE_PATTERN = Pattern.compile("current_role|session_user|current_user");

    private final PolicyNodeVisitor<List<PolicyDependency>> nodeDependencies = new NodeDependencies();

    public List<PolicyDependency> analyzeDependencies(PolicyConditionNode ast, String expression) {
        Map<String, PolicyDependency> dependencies = new LinkedHashMap<>();

        for (List<PolicyDependency> found : PolicyTrees.collect(ast, nodeDependencies)) {
            found.forEach(dependency -> addUnique(dependencies, dependency));
        }
        extractTextDependencies(expression).forEach(dependency -> addUnique(dependencies, dependency));

        log.trace("Found {} dependencies in '{}'", dependencies.size(), expression);
        return new ArrayList<>(dependencies.values());
    }

    private static void addUnique(Map<String, PolicyDependency> dependencies, PolicyDependency dependency) {
        dependencies.putIfAbsent(dependency.type() + ":" + dependency.name(), dependency);
    }

    private List<PolicyDependency> extractTextDependencies(String expression) {
        List<PolicyDependency> dependencies = new ArrayList<>();

        if (expression.contains(AUTH_UID_CALL)) {
            dependencies.add(new PolicyDependency(
                    DependencyType.SESSION_VARIABLE,
                    "auth.uid",
                    true,
                    "Requires authenticated user session",
                    List.of("Depends on authentication state", "Critical for user isolation")));
        }

        Matcher roleMatcher = ROLE_PATTERN.matcher(expression);
        while (roleMatcher.find()) {
            String role = roleMatcher.group();
            dependencies.add(new PolicyDependency(
                    DependencyType.ROLE,
                    role,
                    true,
                    "Role-based access control: " + role,
                    List.of("Role-dependent access", "Security context required")));
        }

        return dependencies;
    }

    static List<String> columnSecurityImplications(String columnName) {
        String lower = columnName.toLowerCase(Locale.ROOT);
        List<String> implications = new ArrayList<>();

        if (lower.contains("id")) {
            implications.add("Contains identifying information");
        }
        if (lower.contains("user") || lower.contains("account")) {
            implications.add("User-related data - high privacy sensitivity");
        }
        if (lower.contains("password") || lower.contains("secret")) {
            implications.add("Contains sensitive authentication data");
        }

        return implications;
    }

    static List<String> functionSecurityImplications(String functionName) {
        List<String> implications = new ArrayList<>();

        if (SECURITY_FUNCTIONS.contains(functionName)) {
            implications.add("Security-related function - critical for access control");
        }
        if (functionName.contains("auth.")) {
            implications.add("Authentication function - ensure proper context");
        }
        if (functionName.contains("current_")) {
            implications.add("Session-dependent function - context sensitive");
        }

        return implications;
    }

    /**
     * First word of a from item such as {@code members m}; null for derived tables.
     */
    private static String tableName(String fromItem) {
        String trimmed = fromItem.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("(")) {
            return null;
        }
        return trimmed.split("\\s+")[0];
    }

    private static final class NodeDependencies implements PolicyNodeVisitor<List<PolicyDependency>> {

        @Override
        public List<PolicyDependency> visitColumn(ColumnNode node) {
            return List.of(new PolicyDependency(
                    DependencyType.COLUMN,
                    node.columnName(),
                    true,
                    "Column reference: " + node.columnName(),
                    columnSecurityImplications(node.columnName())));
        }

        @Override
        public List<PolicyDependency> visitFunction(FunctionNode node) {
            return List.of(new PolicyDependency(
                    DependencyType.FUNCTION,
                    node.functionName(),
                    true,
                    "Function call: " + node.functionName() + "()",
                    functionSecurityImplications(node.functionName())));
        }

        @Override
        public List<PolicyDependency> visitSubquery(SubqueryNode node) {
            if (node.subquery() == null) {
                return List.of();
            }
            List<String> tables = new ArrayList<>();
            node.subquery().from().forEach(item -> tables.add(tableName(item)));
            for (JoinClause join : node.subquery().joins()) {
                tables.add(tableName(join.table()));
            }

            List<PolicyDependency> dependencies = new ArrayList<>();
            for (String table : tables) {
                if (table != null) {
                    dependencies.add(new PolicyDependency(
                            DependencyType.TABLE,
                            table,
                            true,
                            "Table read by subquery: " + table,
                            List.of("Row-level security on " + table + " also applies inside the policy")));
                }
            }
            return dependencies;
        }

        @Override
        public List<PolicyDependency> visitComparison(ComparisonNode node) {
            return List.of();
        }

        @Override
        public List<PolicyDependency> visitLogical(LogicalNode node) {
            return List.of();
        }

        @Override
        public List<PolicyDependency> visitLiteral(LiteralNode node) {
            return List.of();
        }
    }
}
