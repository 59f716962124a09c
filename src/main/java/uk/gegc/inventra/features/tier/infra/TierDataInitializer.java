package uk.gegc.inventra.features.tier.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.inventra.features.tier.application.TierProperties;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;
import uk.gegc.inventra.features.tier.infra.repository.TierFeatureDefinitionRepository;

import java.util.ArrayList;
import java.util.List;

import static uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan.FREE;
import static uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan.PREMIUM;

/**
 * Seeds the default free and premium feature catalog when the table is empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TierDataInitializer implements CommandLineRunner {

    private final TierFeatureDefinitionRepository definitionRepository;
    private final TierProperties tierProperties;

    @Override
    @Transactional
    public void run(String... args) {
        if (!tierProperties.isSeedDefaults()) {
            log.debug("Tier catalog seeding disabled");
            return;
        }
        if (definitionRepository.count() > 0) {
            log.debug("Tier catalog already present, skipping seed");
            return;
        }
        List<TierFeatureDefinition> defaults = defaultDefinitions();
        definitionRepository.saveAll(defaults);
        log.info("Seeded {} default tier feature definitions", defaults.size());
    }

    static List<TierFeatureDefinition> defaultDefinitions() {
        List<TierFeatureDefinition> d = new ArrayList<>();

        d.add(limited(FREE, "product_slot", 50, "Active product slots consumed by the free tier"));
        d.add(limited(FREE, "max_products", 50, "Maximum number of active products for free tier"));
        d.add(limited(FREE, "max_categories", 20, "Maximum number of product categories for free tier"));
        d.add(limited(FREE, "max_file_upload_size_mb", 5, "Maximum file upload size in MB for Excel imports"));
        d.add(limited(FREE, "max_products_per_import", 200, "Maximum number of products per Excel import"));
        d.add(limited(FREE, "max_import_history", 10, "Maximum number of import history records to keep"));
        d.add(limited(FREE, "stock_movement_history_days", 30, "Number of days to keep stock movement history"));
        d.add(limited(FREE, "notification_history_limit", 50, "Maximum number of notification history records to keep"));
        d.add(limited(FREE, "notification_check_frequency_hours", 6, "Standard check frequency for notifications in hours"));
        d.add(limited(FREE, "dashboard_chart_days", 7, "Number of days for dashboard charts"));
        d.add(limited(FREE, "data_retention_years", 1, "Data retention period in years"));
        d.add(disabled(FREE, "analytics_access", "Access to advanced analytics features"));
        d.add(disabled(FREE, "export_capabilities", "Data export capabilities"));
        d.add(disabled(FREE, "priority_support", "Priority email support"));
        d.add(disabled(FREE, "bulk_operations", "Bulk product operations"));
        d.add(disabled(FREE, "custom_notification_schedules", "Custom notification schedules"));
        d.add(disabled(FREE, "advanced_message_templates", "Advanced message templates with branding"));
        d.add(disabled(FREE, "multiple_whatsapp_numbers", "Multiple WhatsApp numbers support"));
        d.add(disabled(FREE, "scheduled_reports", "Scheduled automated reports"));

        d.add(unlimited(PREMIUM, "product_slot", "Unlimited product slots for premium tier"));
        d.add(unlimited(PREMIUM, "max_products", "Unlimited products for premium tier"));
        d.add(unlimited(PREMIUM, "max_categories", "Unlimited product categories for premium tier"));
        d.add(limited(PREMIUM, "max_file_upload_size_mb", 20, "Maximum file upload size in MB for Excel imports (premium)"));
        d.add(unlimited(PREMIUM, "max_products_per_import", "Unlimited products per Excel import"));
        d.add(unlimited(PREMIUM, "max_import_history", "Complete import history for premium tier"));
        d.add(unlimited(PREMIUM, "stock_movement_history_days", "Unlimited stock movement history"));
        d.add(unlimited(PREMIUM, "notification_history_limit", "Complete notification history with analytics"));
        d.add(limited(PREMIUM, "notification_check_frequency_hours", 1, "Custom notification check frequency (1-24 hours)"));
        d.add(unlimited(PREMIUM, "dashboard_chart_days", "Custom date range reports for premium tier"));
        d.add(limited(PREMIUM, "data_retention_years", 3, "Extended data retention period in years"));
        d.add(unlimited(PREMIUM, "analytics_access", "Access to advanced analytics features"));
        d.add(unlimited(PREMIUM, "export_capabilities", "Full data export capabilities"));
        d.add(unlimited(PREMIUM, "priority_support", "Priority email support (24-hour response)"));
        d.add(unlimited(PREMIUM, "bulk_operations", "Bulk product operations"));
        d.add(unlimited(PREMIUM, "custom_notification_schedules", "Custom notification schedules"));
        d.add(unlimited(PREMIUM, "advanced_message_templates", "Advanced message templates with branding"));
        d.add(unlimited(PREMIUM, "multiple_whatsapp_numbers", "Multiple WhatsApp numbers support"));
        d.add(unlimited(PREMIUM, "scheduled_reports", "Scheduled automated reports"));
        d.add(unlimited(PREMIUM, "advanced_audit_trail", "Advanced audit trail with user tracking"));
        d.add(unlimited(PREMIUM, "stock_accuracy_analysis", "Stock accuracy analysis and reconciliation reports"));
        d.add(unlimited(PREMIUM, "movement_data_export", "Movement data export (Excel/CSV)"));
        d.add(unlimited(PREMIUM, "advanced_sales_analytics", "Advanced sales analytics with profit margin analysis"));
        d.add(unlimited(PREMIUM, "product_performance_insights", "Product performance insights and analytics"));
        d.add(unlimited(PREMIUM, "priority_sms_delivery", "Priority SMS delivery when WhatsApp fails"));
        return d;
    }

    private static TierFeatureDefinition limited(SubscriptionPlan tier, String feature, int limit, String description) {
        return new TierFeatureDefinition(tier, feature, limit, true, description);
    }

    private static TierFeatureDefinition unlimited(SubscriptionPlan tier, String feature, String description) {
        return new TierFeatureDefinition(tier, feature, null, true, description);
    }

    private static TierFeatureDefinition disabled(SubscriptionPlan tier, String feature, String description) {
        return new TierFeatureDefinition(tier, feature, null, false, description);
    }
}
