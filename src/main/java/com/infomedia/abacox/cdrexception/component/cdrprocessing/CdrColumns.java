package com.infomedia.abacox.cdrexception.component.cdrprocessing;

/**
 * Column names as they appear in Cisco CM CDR and CMR flat-file headers.
 * Matching against file headers is case-insensitive.
 */
public final class CdrColumns {

    private CdrColumns() {
    }

    public static final String CDR_RECORD_TYPE = "cdrRecordType";
    public static final String CALL_MANAGER_ID = "globalCallID_callManagerId";
    // Short alias used by some exports and by hand-made extracts
    public static final String CALL_MANAGER_ID_ALIAS = "callManagerId";
    public static final String GLOBAL_CALL_ID = "globalCallID_callId";
    public static final String DURATION = "duration";

    // --- CDR ---
    public static final String DATE_TIME_ORIGINATION = "dateTimeOrigination";
    public static final String ORIG_IP_ADDR = "origIpv4v6Addr";
    public static final String DEST_IP_ADDR = "destIpv4v6Addr";
    public static final String CALLING_PARTY_NUMBER = "callingPartyNumber";
    public static final String ORIGINAL_CALLED_PARTY_NUMBER = "originalCalledPartyNumber";
    public static final String FINAL_CALLED_PARTY_NUMBER = "finalCalledPartyNumber";
    public static final String ORIG_CAUSE_VALUE = "origCause_value";
    public static final String DEST_CAUSE_VALUE = "destCause_value";
    public static final String ORIG_DEVICE_NAME = "origDeviceName";
    public static final String DEST_DEVICE_NAME = "destDeviceName";
    public static final String ORIG_VQ_METRICS = "origVarVQMetrics";
    public static final String DEST_VQ_METRICS = "destVarVQMetrics";

    // --- CMR ---
    public static final String DATE_TIME_STAMP = "dateTimeStamp";
    public static final String DEVICE_NAME = "deviceName";
    public static final String VQ_METRICS = "varVQMetrics";
}
