package io.terraform.tfe;

/**
 * Fixed failure conditions surfaced by the SDK. Each constant is a sentinel: {@link TfeException#is(TfeError)}
 * compares by identity.
 */
public enum TfeError {

    // Library errors that indicate a defect in a payload or model definition.
    INVALID_REQUEST_BODY("request body must be an object or a list of objects"),
    INVALID_STRUCT_FORMAT("payload class can't mix JSON:API and plain JSON field mappings"),
    ITEMS_MUST_BE_LIST("response data must be an array when decoding a list"),

    // Response errors.
    UNAUTHORIZED("unauthorized"),
    RESOURCE_NOT_FOUND("resource not found"),
    INVALID_INCLUDE_VALUE("invalid value for \"include\" field"),
    CANCELLED("request cancelled"),

    // Invalid values.
    INVALID_ORG("invalid value for organization"),
    INVALID_NAME("invalid value for name"),
    INVALID_WORKSPACE_ID("invalid value for workspace ID"),
    INVALID_WORKSPACE_VALUE("invalid value for workspace"),
    INVALID_PROJECT_ID("invalid value for project ID"),
    INVALID_TEAM_ID("invalid value for team ID"),
    INVALID_AGENT_POOL_ID("invalid value for agent pool ID"),
    INVALID_VARIABLE_SET_ID("invalid variable set ID"),
    INVALID_NOTIFICATION_CONFIG_ID("invalid value for notification configuration ID"),
    INVALID_NOTIFICATION_TRIGGER("invalid value for notification trigger"),
    INVALID_RUN_ID("invalid value for run ID"),
    INVALID_PLAN_ID("invalid value for plan ID"),
    INVALID_APPLY_ID("invalid value for apply ID"),
    INVALID_NAMESPACE("invalid value for namespace"),
    PRIVATE_NAMESPACE_MISMATCH("namespace must match organization name for private providers"),
    INVALID_REGISTRY_NAME("invalid value for registry-name. It must be either \"private\" or \"public\""),
    INVALID_STACK_ID("invalid value for stack ID"),
    INVALID_CALLBACK_URL("invalid value for callback URL"),
    INVALID_ACCESS_TOKEN("invalid value for access token"),
    INVALID_TASK_RESULTS_CALLBACK_STATUS("invalid value for task result status"),
    INVALID_URL("invalid value for URL"),

    // Missing values.
    REQUIRED_NAME("name is required"),
    REQUIRED_EMAIL("email is required"),
    REQUIRED_NAMESPACE("namespace is required"),
    REQUIRED_DESTINATION_TYPE("destination type is required"),
    REQUIRED_ENABLED("enabled is required"),
    REQUIRED_URL("url is required"),
    REQUIRED_WORKSPACE("workspace is required"),
    REQUIRED_WORKSPACES_LIST("workspaces is required"),
    REQUIRED_PROJECT("project is required"),
    REQUIRED_GLOBAL_FLAG("global flag is required");

    private final String message;

    TfeError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
