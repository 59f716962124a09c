package uk.gegc.inventra.features.tier.domain.model;

import java.util.Map;

/**
 * Feature keys referenced in code, and the human-readable names used in user-facing messages.
 */
public final class FeatureNames {

    public static final String PRODUCT_SLOT = "product_slot";
    public static final String MAX_PRODUCTS = "max_products";
    public static final String MAX_CATEGORIES = "max_categories";
    public static final String MAX_FILE_UPLOAD_SIZE_MB = "max_file_upload_size_mb";
    public static final String MAX_PRODUCTS_PER_IMPORT = "max_products_per_import";
    public static final String ANALYTICS_ACCESS = "analytics_access";
    public static final String EXPORT_CAPABILITIES = "export_capabilities";
    public static final String BULK_OPERATIONS = "bulk_operations";

    private static final Map<String, String> DISPLAY_NAMES = Map.ofEntries(
            Map.entry(PRODUCT_SLOT, "products"),
            Map.entry(MAX_PRODUCTS, "products"),
            Map.entry("categories", "categories"),
            Map.entry(MAX_CATEGORIES, "categories"),
            Map.entry(MAX_FILE_UPLOAD_SIZE_MB, "file upload size"),
            Map.entry(MAX_PRODUCTS_PER_IMPORT, "products per import"),
            Map.entry("max_import_history", "import history records"),
            Map.entry("stock_movement_history_days", "stock movement history days"),
            Map.entry("notification_history_limit", "notification history records"),
            Map.entry("notification_check_frequency_hours", "notification check frequency"),
            Map.entry("dashboard_chart_days", "dashboard chart days"),
            Map.entry("data_retention_years", "data retention years"),
            Map.entry(ANALYTICS_ACCESS, "analytics access"),
            Map.entry(EXPORT_CAPABILITIES, "data export capabilities"),
            Map.entry("priority_support", "priority support"),
            Map.entry(BULK_OPERATIONS, "bulk operations"),
            Map.entry("custom_notification_schedules", "custom notification schedules"),
            Map.entry("advanced_message_templates", "advanced message templates"),
            Map.entry("multiple_whatsapp_numbers", "multiple WhatsApp numbers"),
            Map.entry("scheduled_reports", "scheduled reports"),
            Map.entry("advanced_audit_trail", "advanced audit trail"),
            Map.entry("stock_accuracy_analysis", "stock accuracy analysis"),
            Map.entry("movement_data_export", "movement data export"),
            Map.entry("advanced_sales_analytics", "advanced sales analytics"),
            Map.entry("product_performance_insights", "product performance insights"),
            Map.entry("priority_sms_delivery", "priority SMS delivery")
    );

    private FeatureNames() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Falls back to the key with underscores replaced by spaces.
     */
    public static String displayName(String feature) {
        String name = DISPLAY_NAMES.get(feature);
        return name != null ? name : feature.replace('_', ' ');
    }
}
