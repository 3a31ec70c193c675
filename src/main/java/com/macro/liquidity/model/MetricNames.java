package com.macro.liquidity.model;

/**
 * Column names shared between collaborators, derivations and analysis components.
 * Monetary balances are in millions unless the name says otherwise.
 */
public final class MetricNames {

    private MetricNames() {}

    // ── Raw inputs ──
    public static final String FED_TOTAL_ASSETS = "Fed_Total_Assets";
    public static final String TREASURY_HOLDINGS = "Treasury_Holdings";
    public static final String MBS_HOLDINGS = "MBS_Holdings";
    public static final String BILLS_HOLDINGS = "Bills_Holdings";
    /** Reverse-repo facility balance, published in billions. */
    public static final String RRP_BALANCE = "RRP_Balance";
    public static final String TGA_BALANCE = "TGA_Balance";
    public static final String REPO_OPS_BALANCE = "Repo_Ops_Balance";
    public static final String SWAP_LINES = "Swap_Lines";
    public static final String SOFR = "SOFR";
    public static final String EFFR = "EFFR";
    public static final String IORB = "IORB";
    public static final String TGCR = "TGCR";
    public static final String TREASURY_2Y = "Treasury_2Y";
    public static final String TREASURY_5Y = "Treasury_5Y";
    public static final String TREASURY_10Y = "Treasury_10Y";
    public static final String TREASURY_30Y = "Treasury_30Y";
    public static final String BREAKEVEN_10Y = "Breakeven_10Y";
    public static final String TOTAL_SPENDING = "Total_Spending";
    public static final String HOUSEHOLD_SPENDING = "Household_Spending";
    public static final String TOTAL_TAXES = "Total_Taxes";
    public static final String WITHHELD_TAX = "Withheld_Tax";
    public static final String REPO_SUBMISSION_RATIO = "Repo_Submission_Ratio";
    public static final String SETTLEMENT_FAILS = "Settlement_Fails";
    public static final String OFR_REPO_STRESS = "OFR_Repo_Stress";

    // ── Unit normalization ──
    public static final String RRP_BALANCE_M = "RRP_Balance_M";

    // ── Net liquidity ──
    public static final String NET_LIQUIDITY = "Net_Liquidity";
    public static final String NET_LIQUIDITY_NO_TGA = "Net_Liquidity_No_TGA";

    // ── Spreads ──
    public static final String SPREAD_SOFR_IORB = "Spread_SOFR_IORB";
    public static final String SPREAD_EFFR_IORB = "Spread_EFFR_IORB";
    public static final String SPREAD_TGCR_SOFR = "Spread_TGCR_SOFR";
    public static final String CURVE_2S10S = "Curve_2s10s";
    public static final String CURVE_5S30S = "Curve_5s30s";

    // ── Policy stance ──
    public static final String MBS_RUNOFF_WEEKLY = "MBS_Runoff_Weekly";
    public static final String BILL_PURCHASES_WEEKLY = "Bill_Purchases_Weekly";
    public static final String MBS_TO_BILLS_REINVESTMENT = "MBS_to_Bills_Reinvestment";
    public static final String NET_BALANCE_SHEET_FLOW = "Net_Balance_Sheet_Flow";
    public static final String QT_PACE_NOMINAL = "QT_Pace_Nominal";
    public static final String QUALITATIVE_EASING_SUPPORT = "Qualitative_Easing_Support";

    // ── Changes and pace ──
    public static final String RRP_CHANGE = "RRP_Change";
    public static final String NET_LIQ_CHANGE = "Net_Liq_Change";
    public static final String TGA_CHANGE = "TGA_Change";
    public static final String QT_PACE_ASSETS_WEEKLY = "QT_Pace_Assets_Weekly";
    public static final String QT_PACE_TREASURY_WEEKLY = "QT_Pace_Treasury_Weekly";
    public static final String BILL_BUYING_PACE_WEEKLY = "Bill_Buying_Pace_Weekly";

    // ── Volatility ──
    public static final String SOFR_VOL_5D = "SOFR_Vol_5D";
    public static final String STRESS_FLAG = "Stress_Flag";

    // ── Moving averages, YoY, MTD ──
    public static final String MA20_RRP = "MA20_RRP";
    public static final String MA5_RRP = "MA5_RRP";
    public static final String MA20_ASSETS = "MA20_Assets";
    public static final String MA20_SPREAD_SOFR_IORB = "MA20_Spread_SOFR_IORB";
    public static final String MA20_NET_LIQ = "MA20_Net_Liq";
    public static final String MA5_NET_LIQ = "MA5_Net_Liq";
    public static final String YOY_RRP_CHANGE = "YoY_RRP_Change";
    public static final String YOY_ASSETS_CHANGE = "YoY_Assets_Change";
    public static final String YOY_NET_LIQ_CHANGE = "YoY_Net_Liq_Change";
    public static final String MTD_ASSETS_CHANGE = "MTD_Assets_Change";
    public static final String MTD_NET_LIQ_CHANGE = "MTD_Net_Liq_Change";
    public static final String MTD_RRP_FLOW = "MTD_RRP_Flow";

    // ── Fiscal ──
    public static final String NET_IMPULSE = "Net_Impulse";
    public static final String MA20_IMPULSE = "MA20_Impulse";
    public static final String MA5_IMPULSE = "MA5_Impulse";
    public static final String MA20_NET_IMPULSE = "MA20_Net_Impulse";
    public static final String FOUR_WEEK_CUM_IMPULSE = "4W_Cum_Impulse";
    public static final String FOUR_WEEK_CUM_NET = "4W_Cum_Net";
    public static final String HOUSEHOLD_SHARE_PCT = "Household_Share_Pct";
    public static final String TGA_DRAWDOWN = "TGA_Drawdown";

    /** Columns produced by the {@code prefix} multi-horizon change family. */
    public static String weeklyChange(String prefix) {
        return prefix + "_Weekly_Change";
    }

    public static String monthlyChange(String prefix) {
        return prefix + "_Monthly_Change";
    }

    public static String quarterlyChange(String prefix) {
        return prefix + "_Quarterly_Change";
    }
}
