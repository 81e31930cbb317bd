package com.hostpanel.orchestrator.migration;

import java.util.Locale;

/**
 * Maps the guest OS name reported by the source to a Proxmox "ostype".
 */
final class GuestOsMapper {

    private GuestOsMapper() {}

    static String toOsType(String guestOS) {
        if (guestOS == null) {
            return "other";
        }
        String os = guestOS.toLowerCase(Locale.ROOT);
        if (os.contains("windows")) {
            if (os.contains("windows 11") || os.contains("2022") || os.contains("2025")) {
                return "win11";
            }
            if (os.contains("windows 10") || os.contains("2016") || os.contains("2019")) {
                return "win10";
            }
            if (os.contains("windows 8") || os.contains("2012")) {
                return "win8";
            }
            return "win7";
        }
        if (os.contains("linux") || os.contains("ubuntu") || os.contains("debian") || os.contains("centos")
                || os.contains("red hat") || os.contains("rhel") || os.contains("rocky")
                || os.contains("alma") || os.contains("suse")) {
            return "l26";
        }
        if (os.contains("solaris")) {
            return "solaris";
        }
        return "other";
    }
}
