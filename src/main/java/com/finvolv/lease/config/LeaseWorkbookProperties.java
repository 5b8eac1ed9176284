package com.finvolv.lease.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.regex.Pattern;

/**
 * Sheet and column names of the uploaded workbook. Defaults match the published input template.
 */
@Data
@ConfigurationProperties(prefix = "lease.workbook")
public class LeaseWorkbookProperties {

    private ContractSheet contracts = new ContractSheet();
    private BankSheet bank = new BankSheet();
    private InvoiceSheet invoices = new InvoiceSheet();

    @Data
    public static class ContractSheet {
        private String sheetName = "合同原始数据";
        private String customerName = "客户名称";
        private String merchantId = "商户编号";
        private String deliveryDate = "交付日";
        private String leaseEndDate = "租期届满日";
        private String freeRentDays = "免租期";
        /** Header of the mandatory first-year tier. */
        private String firstTier = "保底租金第1年（必须）";
        /** Header of tier N, with {@code {n}} standing for the lease year. */
        private String tierTemplate = "保底租金第{n}年";
        /** Group 1 captures the lease year of any tier header. */
        private String tierPattern = "保底租金第(\\d+)年";

        public Pattern compiledTierPattern() {
            return Pattern.compile(tierPattern);
        }

        public String tierHeader(int leaseYear) {
            return leaseYear == 1 ? firstTier : tierTemplate.replace("{n}", String.valueOf(leaseYear));
        }
    }

    @Data
    public static class BankSheet {
        private String sheetName = "银行对账单";
        private String transactionDate = "交易时间";
        private String creditedAmount = "贷方发生额（收入）";
        private String counterpartyName = "对方户名";
    }

    @Data
    public static class InvoiceSheet {
        private String sheetName = "发票信息汇总表";
        private String buyerName = "购买方名称";
        private String invoiceDate = "开票日期";
        private String totalAmount = "价税合计";
    }
}
