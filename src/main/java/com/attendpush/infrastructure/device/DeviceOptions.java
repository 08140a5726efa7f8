package com.attendpush.infrastructure.device;

import com.attendpush.domain.model.AttendancePunch;

/**
 * Documento de capacidades que recibe el terminal en {@code cdata?options=all}.
 */
public final class DeviceOptions {

    private static final String TEMPLATE = String.join("\n",
            "GET OPTION FROM:{SN}",
            "Stamp=9999",
            "OpStamp=9999",
            "PhotoStamp=0",
            "TransFlag=TransData AttLog\tOpLog\tAttPhoto\tEnrollUser\tChgUser\tEnrollFP\tChgFP\tFPImag\tFACE\tUserPic\tWORKCODE\tBioPhoto",
            "ErrorDelay=120",
            "Delay=10",
            "TimeZone=120",
            "TransTimes=",
            "TransInterval=30",
            "SyncTime=0",
            "Realtime=1",
            "ServerVer=2.2.14 2025/02/19",
            "PushProtVer=2.4.1",
            "PushOptionsFlag=1",
            "ATTLOGStamp=9999",
            "OPERLOGStamp=9999",
            "ATTPHOTOStamp=0",
            "ServerName=Logtime Server",
            "MultiBioDataSupport=0:1:0:0:0:0:0:0:0:");

    private DeviceOptions() {
    }

    public static String render(String serial) {
        String sn = serial == null || serial.isBlank() ? AttendancePunch.UNKNOWN_SERIAL : serial;
        return TEMPLATE.replace("{SN}", sn);
    }
}
