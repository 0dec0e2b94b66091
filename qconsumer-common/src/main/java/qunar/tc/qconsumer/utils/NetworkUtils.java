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

package qunar.tc.qconsumer.utils;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.util.ArrayList;
import java.util.Enumeration;

public class NetworkUtils {
    private static final Logger LOG = LoggerFactory.getLogger(NetworkUtils.class);

    private static final String LOCALHOST = "127.0.0.1";

    /**
     * 优先返回非回环的IPv4地址, 其次IPv6, 都没有时返回127.0.0.1
     */
    public static String getLocalAddress() {
        try {
            final Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            final ArrayList<String> ipv4Result = new ArrayList<>();
            final ArrayList<String> ipv6Result = new ArrayList<>();
            while (interfaces != null && interfaces.hasMoreElements()) {
                final NetworkInterface networkInterface = interfaces.nextElement();
                if (!networkInterface.isUp()) continue;
                if (networkInterface.isVirtual()) continue;

                final Enumeration<InetAddress> addresses = networkInterface.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    final InetAddress address = addresses.nextElement();
                    if (address.isLoopbackAddress()) continue;
                    if (address instanceof Inet6Address) {
                        ipv6Result.add(address.getHostAddress());
                    } else {
                        ipv4Result.add(address.getHostAddress());
                    }
                }
            }

            for (String ip : ipv4Result) {
                if (!ip.startsWith("127.0")) {
                    return ip;
                }
            }
            if (!ipv6Result.isEmpty()) {
                return ipv6Result.get(0);
            }
        } catch (Exception e) {
            LOG.error("get local address failed", e);
        }

        return LOCALHOST;
    }

    /**
     * 校验name server地址, 格式为host:port, 不做域名解析
     */
    public static boolean isValid(String address) {
        if (Strings.isNullOrEmpty(address)) return false;

        final int idx = address.lastIndexOf(':');
        if (idx <= 0 || idx == address.length() - 1) return false;

        final String host = address.substring(0, idx).trim();
        if (host.isEmpty()) return false;
        try {
            final int port = Integer.parseInt(address.substring(idx + 1).trim());
            return port > 0 && port <= 65535;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
