package io.terraform.tfe.organization;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

/**
 * Organization endpoints.
 *
 * <p>
 * Every method validates its identifiers before any request is made and throws a {@link TfeException} carrying the
 * matching {@link TfeError} when one is malformed.
 * </p>
 */
public final class Organizations {

    private final TfeClient client;

    public Organizations(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Lists the organizations visible to the token.
     *
     * @param options pagination and search, may be {@code null}.
     */
    public ResourceList<Organization> list(OrganizationListOptions options) throws TfeException {
        return client.newRequest("GET", "organizations", null, options).decodeList(Organization.class);
    }

    public Organization create(OrganizationCreateOptions options) throws TfeException {
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (!validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        if (!validString(options.getEmail())) {
            throw new TfeException(TfeError.REQUIRED_EMAIL);
        }
        return client.newRequest("POST", "organizations", options, null).decode(Organization.class);
    }

    public Organization read(String organization) throws TfeException {
        return readWithOptions(organization, null);
    }

    /**
     * Reads an organization, side-loading the relations named in {@code options}.
     */
    public Organization readWithOptions(String organization, OrganizationReadOptions options) throws TfeException {
        requireOrganization(organization);
        return client.newRequest("GET", path(organization), null, options).decode(Organization.class);
    }

    public Organization update(String organization, OrganizationUpdateOptions options) throws TfeException {
        requireOrganization(organization);
        Objects.requireNonNull(options, "options");
        if (options.getName() != null && !validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("PATCH", path(organization), options, null).decode(Organization.class);
    }

    public void delete(String organization) throws TfeException {
        requireOrganization(organization);
        client.newRequest("DELETE", path(organization), null, null).execute();
    }

    /**
     * Reports how many runs are pending and running in the organization.
     */
    public OrganizationCapacity readCapacity(String organization) throws TfeException {
        requireOrganization(organization);
        return client.newRequest("GET", path(organization) + "/capacity", null, null)
            .decode(OrganizationCapacity.class);
    }

    public Entitlements readEntitlements(String organization) throws TfeException {
        requireOrganization(organization);
        return client.newRequest("GET", path(organization) + "/entitlement-set", null, null)
            .decode(Entitlements.class);
    }

    private static String path(String organization) {
        return "organizations/" + escape(organization);
    }

    private static void requireOrganization(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
    }
}
