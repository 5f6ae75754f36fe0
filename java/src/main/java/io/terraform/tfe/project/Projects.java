package io.terraform.tfe.project;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

public final class Projects {

    private final TfeClient client;

    public Projects(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<Project> list(String organization, ProjectListOptions options) throws TfeException {
        return client.newRequest("GET", organizationPath(organization), null, options).decodeList(Project.class);
    }

    public Project create(String organization, ProjectCreateOptions options) throws TfeException {
        String path = organizationPath(organization);
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (!validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("POST", path, options, null).decode(Project.class);
    }

    public Project read(String projectId) throws TfeException {
        return client.newRequest("GET", projectPath(projectId), null, null).decode(Project.class);
    }

    public Project update(String projectId, ProjectUpdateOptions options) throws TfeException {
        String path = projectPath(projectId);
        Objects.requireNonNull(options, "options");
        if (options.getName() != null && !validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("PATCH", path, options, null).decode(Project.class);
    }

    public void delete(String projectId) throws TfeException {
        client.newRequest("DELETE", projectPath(projectId), null, null).execute();
    }

    private static String organizationPath(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return "organizations/" + escape(organization) + "/projects";
    }

    private static String projectPath(String projectId) throws TfeException {
        if (!validStringId(projectId)) {
            throw new TfeException(TfeError.INVALID_PROJECT_ID);
        }
        return "projects/" + escape(projectId);
    }
}
