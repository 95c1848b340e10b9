package com.scrapebatch.core.util;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** 진단용 호스트 정보 */
public final class HostInfo {
    private HostInfo() {}

    /** 로컬 호스트명. DNS가 없으면 HOSTNAME 환경변수, 그것도 없으면 "unknown" */
    public static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return (env == null || env.isBlank()) ? "unknown" : env;
        }
    }
}
