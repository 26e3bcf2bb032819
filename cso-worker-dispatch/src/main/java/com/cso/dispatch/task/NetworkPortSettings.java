package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/** One exposed port of a deployed service. */
public final class NetworkPortSettings {

    @JsonProperty("portNumber")
    @JsonDeserialize(using = FlexIntDeserializer.class)
    private int portNumber;

    @JsonProperty("portType")
    private String portType;

    @JsonProperty("public")
    private boolean publicPort;

    @JsonProperty("domain")
    private String domain;

    @JsonProperty("custom_domain")
    private String customDomain;

    NetworkPortSettings() {
    }

    public int getPortNumber() {
        return portNumber;
    }

    public String getPortType() {
        return portType;
    }

    public boolean isPublic() {
        return publicPort;
    }

    public String getDomain() {
        return domain;
    }

    public String getCustomDomain() {
        return customDomain;
    }
}
