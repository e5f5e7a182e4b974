package com.flagship.trade_ledger.group;

import com.flagship.trade_ledger.support.Actors;
import com.flagship.trade_ledger.support.Slugs;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.flagship.trade_ledger.group.GroupType.ASSETS;
import static com.flagship.trade_ledger.group.GroupType.EXPENSES;
import static com.flagship.trade_ledger.group.GroupType.INCOME;
import static com.flagship.trade_ledger.group.GroupType.LIABILITY;

/**
 * Seeds the standard chart of account groups on startup.
 * Idempotent: groups are matched by slug and only missing ones are created.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "ledger.groups.seed-predefined", havingValue = "true", matchIfMissing = true)
public class PredefinedGroupInitializer implements ApplicationRunner {

    /**
     * Parents are listed before their children.
     */
    static final List<Seed> PREDEFINED = List.of(
        new Seed("Branch / Divisions", ASSETS, null),
        new Seed("Current Assets", ASSETS, null),
        new Seed("Bank Accounts", ASSETS, "Current Assets"),
        new Seed("Cash-in-Hand", ASSETS, "Current Assets"),
        new Seed("Deposits (Asset)", ASSETS, "Current Assets"),
        new Seed("Loans & Advances (Asset)", ASSETS, "Current Assets"),
        new Seed("Stock-in-Hand", ASSETS, "Current Assets"),
        new Seed("Sundry Debtors", ASSETS, "Current Assets"),
        new Seed("Fixed Assets", ASSETS, null),
        new Seed("Investments", ASSETS, null),
        new Seed("Suspense A/c", ASSETS, null),
        new Seed("Misc. Expenses (Asset)", ASSETS, null),
        new Seed("Capital Account", LIABILITY, null),
        new Seed("Reserves & Surplus", LIABILITY, null),
        new Seed("Current Liabilities", LIABILITY, null),
        new Seed("Bank OD A/c", LIABILITY, "Current Liabilities"),
        new Seed("Sundry Creditors", LIABILITY, "Current Liabilities"),
        new Seed("Duties & Taxes", LIABILITY, "Current Liabilities"),
        new Seed("Provisions", LIABILITY, "Current Liabilities"),
        new Seed("Loans (Liability)", LIABILITY, null),
        new Seed("Secured Loans", LIABILITY, "Loans (Liability)"),
        new Seed("Unsecured Loans", LIABILITY, "Loans (Liability)"),
        new Seed("Sales Accounts", INCOME, null),
        new Seed("Direct Income", INCOME, null),
        new Seed("Indirect Income", INCOME, null),
        new Seed("Purchase Accounts", EXPENSES, null),
        new Seed("Direct Expenses", EXPENSES, null),
        new Seed("Indirect Expenses", EXPENSES, null)
    );

    private final GroupRepository groupRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        Map<String, UUID> idsByName = new HashMap<>();
        int created = 0;
        for (Seed seed : PREDEFINED) {
            UUID parentId = seed.getParentName() == null ? null : idsByName.get(seed.getParentName());
            GroupEntity group = groupRepository.findBySlug(Slugs.slugify(seed.getName()))
                .orElse(null);
            if (group == null) {
                group = groupRepository.save(GroupEntity.predefined(seed.getName(), seed.getType(), parentId, Actors.SYSTEM));
                created++;
            }
            idsByName.put(seed.getName(), group.getId());
        }
        log.info("Predefined groups initialized: created={}, total={}", created, PREDEFINED.size());
    }

    @Value
    static class Seed {
        String name;
        GroupType type;
        String parentName;
    }
}
