package analysis;

import engine.ErrorKind;

import java.util.List;

// Fixed table of illustrative inputs; documentation and test seed only.
public final class UsageExamples {
    private UsageExamples() {}

    private static final List<UsageExample> EXAMPLES = List.of(
            new UsageExample("basic_usage",
                    "Basic progressive prefix finding",
                    "Progressive analysis finding common prefixes",
                    List.of("prefix_test_1", "prefix_test_2", "prefix_demo", "prefix_example"),
                    "prefix_", null),
            new UsageExample("file_paths",
                    "Finding common directory paths",
                    "File path analysis",
                    List.of("/home/user/documents/file1.txt",
                            "/home/user/documents/file2.txt",
                            "/home/user/downloads/file3.txt"),
                    "/home/user/do", null),
            new UsageExample("project_paths",
                    "Finding common directory structures",
                    "Source tree layout",
                    List.of("/home/user/projects/web-app/src/components/Button.js",
                            "/home/user/projects/web-app/src/components/Modal.js",
                            "/home/user/projects/web-app/src/utils/helpers.js",
                            "/home/user/projects/mobile-app/src/screens/Home.js"),
                    "/home/user/projects/", null),
            new UsageExample("urls",
                    "URL prefix extraction",
                    "Web crawling and analysis",
                    List.of("https://example.com/api/v1/users",
                            "https://example.com/api/v1/posts",
                            "https://example.com/api/v2/users"),
                    "https://example.com/api/v", null),
            new UsageExample("api_endpoints",
                    "Identifying common URL patterns",
                    "API surface review",
                    List.of("https://api.example.com/v1/users/123/profile",
                            "https://api.example.com/v1/users/456/settings",
                            "https://api.example.com/v1/posts/789/comments",
                            "https://api.example.com/v2/users/101/profile"),
                    "https://api.example.com/v", null),
            new UsageExample("code_patterns",
                    "Identifying common naming patterns",
                    "Code refactoring",
                    List.of("getUserData", "getUserInfo", "getUserProfile", "getPostData"),
                    "get", null),
            new UsageExample("function_names",
                    "Naming patterns that break on the last entry",
                    "Code refactoring",
                    List.of("calculateUserScore", "calculateTeamScore", "calculateGameScore", "validateUserInput"),
                    "", null),
            new UsageExample("database_tables",
                    "Database schema analysis",
                    "Schema grouping",
                    List.of("user_profile_data", "user_login_history", "user_preferences", "admin_user_management"),
                    "", null),
            new UsageExample("edge_empty_list",
                    "Empty list",
                    "Error handling",
                    List.of(),
                    null, ErrorKind.EMPTY_INPUT),
            new UsageExample("edge_single_string",
                    "Single string",
                    "Returns the string itself",
                    List.of("single"),
                    "single", null),
            new UsageExample("edge_no_common_prefix",
                    "No common prefix",
                    "Empty common prefix",
                    List.of("abc", "xyz"),
                    "", null),
            new UsageExample("edge_empty_string",
                    "Empty string in list",
                    "Empty common prefix",
                    List.of("", "abc"),
                    "", null));

    public static List<UsageExample> generate() {
        return EXAMPLES;
    }

    public static UsageExample byName(String name) {
        return EXAMPLES.stream()
                .filter(e -> e.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown usage example: " + name));
    }
}
