/*
 * Copyright 2018 Qunar, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package qunar.tc.qconsumer.common;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import qunar.tc.qconsumer.utils.NetworkUtils;

import java.util.List;

/**
 * Identity and connection settings shared by every kind of client.
 */
public final class ClientOptions {
    public static final String DEFAULT_INSTANCE_NAME = "DEFAULT";
    public static final int DEFAULT_RETRY_TIMES = 3;

    private final String groupName;
    private final ImmutableList<String> nameServerAddrs;
    private final String instanceName;
    private final String namespace;
    private final String clientIp;
    private final boolean aclEnabled;
    private final boolean vipChannelEnabled;
    private final int retryTimes;

    private ClientOptions(Builder builder) {
        this.groupName = builder.groupName;
        this.nameServerAddrs = ImmutableList.copyOf(builder.nameServerAddrs);
        this.instanceName = builder.instanceName;
        this.namespace = builder.namespace;
        this.clientIp = builder.clientIp;
        this.aclEnabled = builder.aclEnabled;
        this.vipChannelEnabled = builder.vipChannelEnabled;
        this.retryTimes = builder.retryTimes;
    }

    public static Builder defaults() {
        return new Builder()
                .setInstanceName(DEFAULT_INSTANCE_NAME)
                .setNamespace("")
                .setClientIp(NetworkUtils.getLocalAddress())
                .setRetryTimes(DEFAULT_RETRY_TIMES);
    }

    public static Builder empty() {
        return new Builder();
    }

    public String getGroupName() {
        return groupName;
    }

    public List<String> getNameServerAddrs() {
        return nameServerAddrs;
    }

    public String getInstanceName() {
        return instanceName;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getClientIp() {
        return clientIp;
    }

    public boolean isAclEnabled() {
        return aclEnabled;
    }

    public boolean isVipChannelEnabled() {
        return vipChannelEnabled;
    }

    public int getRetryTimes() {
        return retryTimes;
    }

    /**
     * Identifies this client among the members of its group, {@code ip@instanceName}.
     */
    public String clientId() {
        return Strings.nullToEmpty(clientIp) + "@" + Strings.nullToEmpty(instanceName);
    }

    public Builder toBuilder() {
        return new Builder()
                .setGroupName(groupName)
                .setNameServerAddrs(nameServerAddrs)
                .setInstanceName(instanceName)
                .setNamespace(namespace)
                .setClientIp(clientIp)
                .setAclEnabled(aclEnabled)
                .setVipChannelEnabled(vipChannelEnabled)
                .setRetryTimes(retryTimes);
    }

    @Override
    public String toString() {
        return "ClientOptions{" +
                "groupName='" + groupName + '\'' +
                ", nameServerAddrs=" + nameServerAddrs +
                ", instanceName='" + instanceName + '\'' +
                ", namespace='" + namespace + '\'' +
                ", clientIp='" + clientIp + '\'' +
                ", aclEnabled=" + aclEnabled +
                ", vipChannelEnabled=" + vipChannelEnabled +
                ", retryTimes=" + retryTimes +
                '}';
    }

    public static final class Builder {
        private String groupName;
        private List<String> nameServerAddrs = ImmutableList.of();
        private String instanceName;
        private String namespace;
        private String clientIp;
        private boolean aclEnabled;
        private boolean vipChannelEnabled;
        private int retryTimes;

        private Builder() {
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }

        public String getGroupName() {
            return groupName;
        }

        public List<String> getNameServerAddrs() {
            return nameServerAddrs;
        }

        public int getRetryTimes() {
            return retryTimes;
        }

        public Builder setGroupName(String groupName) {
            this.groupName = groupName;
            return this;
        }

        public Builder setNameServerAddrs(List<String> nameServerAddrs) {
            this.nameServerAddrs = ImmutableList.copyOf(nameServerAddrs);
            return this;
        }

        public Builder setInstanceName(String instanceName) {
            this.instanceName = instanceName;
            return this;
        }

        public Builder setNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder setClientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder setAclEnabled(boolean aclEnabled) {
            this.aclEnabled = aclEnabled;
            return this;
        }

        public Builder setVipChannelEnabled(boolean vipChannelEnabled) {
            this.vipChannelEnabled = vipChannelEnabled;
            return this;
        }

        public Builder setRetryTimes(int retryTimes) {
            this.retryTimes = retryTimes;
            return this;
        }
    }
}
