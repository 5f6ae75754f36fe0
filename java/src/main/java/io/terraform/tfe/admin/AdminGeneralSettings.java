package io.terraform.tfe.admin;

import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeException;

import java.util.Objects;

/**
 * Site-admin endpoints; Terraform Enterprise only.
 */
public final class AdminGeneralSettings {

    private static final String PATH = "admin/general-settings";

    private final TfeClient client;

    public AdminGeneralSettings(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public AdminGeneralSetting read() throws TfeException {
        return client.newRequest("GET", PATH, null, null).decode(AdminGeneralSetting.class);
    }

    public AdminGeneralSetting update(AdminGeneralSettingsUpdateOptions options) throws TfeException {
        Objects.requireNonNull(options, "options");
        return client.newRequest("PATCH", PATH, options, null).decode(AdminGeneralSetting.class);
    }
}
