package com.eventdaemon.gateway;

import java.util.List;

/**
 * Event names exposed by the gateway connections. Handlers bind to these by string key.
 */
public final class GatewayEventNames {

    public static final String CONNECTED = "connectedEvent";
    public static final String DISCONNECTED = "disconnectedEvent";
    public static final String UPDATE = "updateEvent";
    public static final String PENDING_TICKERS = "pendingTickersEvent";
    public static final String BAR_UPDATE = "barUpdateEvent";
    public static final String NEW_ORDER = "newOrderEvent";
    public static final String ORDER_MODIFY = "orderModifyEvent";
    public static final String CANCEL_ORDER = "cancelOrderEvent";
    public static final String OPEN_ORDER = "openOrderEvent";
    public static final String ORDER_STATUS = "orderStatusEvent";
    public static final String EXEC_DETAILS = "execDetailsEvent";
    public static final String COMMISSION_REPORT = "commissionReportEvent";
    public static final String UPDATE_PORTFOLIO = "updatePortfolioEvent";
    public static final String POSITION = "positionEvent";
    public static final String ACCOUNT_VALUE = "accountValueEvent";
    public static final String ACCOUNT_SUMMARY = "accountSummaryEvent";
    public static final String PNL = "pnlEvent";
    public static final String PNL_SINGLE = "pnlSingleEvent";
    public static final String SCANNER_DATA = "scannerDataEvent";
    public static final String TICK_NEWS = "tickNewsEvent";
    public static final String NEWS_BULLETIN = "newsBulletinEvent";
    public static final String ERROR = "errorEvent";
    public static final String TIMEOUT = "timeoutEvent";

    /** Full set of events a gateway session publishes. */
    public static final List<String> STANDARD = List.of(
            CONNECTED,
            DISCONNECTED,
            UPDATE,
            PENDING_TICKERS,
            BAR_UPDATE,
            NEW_ORDER,
            ORDER_MODIFY,
            CANCEL_ORDER,
            OPEN_ORDER,
            ORDER_STATUS,
            EXEC_DETAILS,
            COMMISSION_REPORT,
            UPDATE_PORTFOLIO,
            POSITION,
            ACCOUNT_VALUE,
            ACCOUNT_SUMMARY,
            PNL,
            PNL_SINGLE,
            SCANNER_DATA,
            TICK_NEWS,
            NEWS_BULLETIN,
            ERROR,
            TIMEOUT);

    private GatewayEventNames() {}
}
