package io.terraform.tfe.team;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

public final class Teams {

    private final TfeClient client;

    public Teams(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<Team> list(String organization, TeamListOptions options) throws TfeException {
        return client.newRequest("GET", organizationPath(organization), null, options).decodeList(Team.class);
    }

    public Team create(String organization, TeamCreateOptions options) throws TfeException {
        String path = organizationPath(organization);
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        return client.newRequest("POST", path, options, null).decode(Team.class);
    }

    public Team read(String teamId) throws TfeException {
        return client.newRequest("GET", teamPath(teamId), null, null).decode(Team.class);
    }

    public Team update(String teamId, TeamUpdateOptions options) throws TfeException {
        String path = teamPath(teamId);
        Objects.requireNonNull(options, "options");
        return client.newRequest("PATCH", path, options, null).decode(Team.class);
    }

    public void delete(String teamId) throws TfeException {
        client.newRequest("DELETE", teamPath(teamId), null, null).execute();
    }

    private static String organizationPath(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return "organizations/" + escape(organization) + "/teams";
    }

    private static String teamPath(String teamId) throws TfeException {
        if (!validStringId(teamId)) {
            throw new TfeException(TfeError.INVALID_TEAM_ID);
        }
        return "teams/" + escape(teamId);
    }
}
