package com.perpradar.bot;

import com.perpradar.common.EvmAddresses;
import com.perpradar.registry.AddWalletResult;
import com.perpradar.registry.LinkedWallet;
import com.perpradar.registry.RegistryProperties;
import com.perpradar.registry.WalletRegistry;
import com.perpradar.subscription.SubscribeResult;
import com.perpradar.subscription.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Chat command surface: /start, /sub, /unsub, /wallet, /list, /add, /remove, /cancel.
 * Plain text is interpreted according to the chat's {@link SessionState}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotCommandHandler {

    static final String SUBSCRIBE_FIRST = "Please subscribe first using /sub.";

    private final SubscriptionService subscriptionService;
    private final WalletRegistry walletRegistry;
    private final ChatSessions chatSessions;
    private final RegistryProperties registryProperties;
    private final BotProperties botProperties;

    /**
     * @return the reply to send back to the chat
     */
    public String handle(long chatId, String displayName, String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.startsWith("/")) {
            return handleCommand(chatId, displayName, trimmed);
        }
        return switch (chatSessions.stateOf(chatId)) {
            case AWAITING_ADDRESS -> addAddress(chatId, trimmed, true);
            case AWAITING_REMOVAL_INDEX -> removeByIndex(chatId, trimmed, true);
            case IDLE -> "Send /wallet to manage your wallets or /start for help.";
        };
    }

    private String handleCommand(long chatId, String displayName, String text) {
        String[] parts = text.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        String args = parts.length > 1 ? parts[1].trim() : "";

        if (!"/cancel".equals(command)) {
            chatSessions.transition(chatId, SessionState.IDLE);
        }
        return switch (command) {
            case "/start", "/help" -> welcome();
            case "/sub", "/subscribe" -> subscribe(chatId, displayName);
            case "/unsub", "/unsubscribe" -> unsubscribe(chatId);
            case "/wallet" -> startWalletInput(chatId);
            case "/list" -> listWallets(chatId);
            case "/add" -> args.isEmpty() ? startWalletInput(chatId) : addAddress(chatId, args, false);
            case "/remove" -> args.isEmpty() ? startRemoval(chatId) : removeByIndex(chatId, args, false);
            case "/cancel" -> cancel(chatId);
            default -> "Unknown command.\n\n" + commandList();
        };
    }

    private String welcome() {
        return "Welcome to Perp Radar!\n\n"
                + "Monitor Hyperliquid perp positions and get an alert when a position changes by more than the "
                + "configured threshold. Wallets are checked every " + botProperties.getPollIntervalMinutes()
                + " minutes.\n\n" + commandList();
    }

    private String commandList() {
        int max = registryProperties.getMaxWalletsPerSubscriber();
        return "Commands:\n"
                + "/sub - Subscribe to alerts\n"
                + "/unsub - Pause alerts (your wallets are kept)\n"
                + "/wallet - Add a wallet to monitor (max " + max + ")\n"
                + "/list - Show your wallets\n"
                + "/remove - Remove a wallet by its number\n"
                + "/cancel - Cancel the current input";
    }

    private String subscribe(long chatId, String displayName) {
        SubscribeResult result = subscriptionService.subscribe(chatId, displayName);
        return switch (result.outcome()) {
            case NEWLY_SUBSCRIBED -> result.defaultWalletAdded() != null
                    ? "✓ You've been subscribed to alerts!\n\nDefault wallet added: "
                    + EvmAddresses.shortForm(result.defaultWalletAdded()) + "\n\nAdd more wallets using /wallet"
                    : "✓ You've been subscribed to alerts!\n\nAdd wallet addresses to monitor using /wallet";
            case REACTIVATED -> "✓ Welcome back! Monitoring resumed for " + result.walletCount() + " wallet(s).";
            case ALREADY_ACTIVE -> result.walletCount() > 0
                    ? "You're already subscribed with " + result.walletCount() + " wallet(s)!\n\nAdd more wallets using /wallet"
                    : "You're already subscribed!\n\nAdd wallet addresses to monitor using /wallet";
        };
    }

    private String unsubscribe(long chatId) {
        if (!subscriptionService.unsubscribe(chatId)) {
            return "You're not subscribed.";
        }
        return "You've been unsubscribed. Your wallets are kept; send /sub to resume alerts.";
    }

    private String startWalletInput(long chatId) {
        if (!subscriptionService.isSubscribed(chatId)) {
            return SUBSCRIBE_FIRST;
        }
        chatSessions.transition(chatId, SessionState.AWAITING_ADDRESS);
        List<LinkedWallet> wallets = walletRegistry.listWallets(chatId);
        String prompt = "Send me an EVM wallet address to add (0x...):";
        if (wallets.isEmpty()) {
            return "You have no wallets yet.\n\n" + prompt;
        }
        return formatWallets(wallets) + "\n\n" + prompt;
    }

    private String listWallets(long chatId) {
        if (!subscriptionService.isSubscribed(chatId)) {
            return SUBSCRIBE_FIRST;
        }
        List<LinkedWallet> wallets = walletRegistry.listWallets(chatId);
        if (wallets.isEmpty()) {
            return "You have no wallets yet. Add one with /wallet";
        }
        return formatWallets(wallets);
    }

    private String startRemoval(long chatId) {
        if (!subscriptionService.isSubscribed(chatId)) {
            return SUBSCRIBE_FIRST;
        }
        List<LinkedWallet> wallets = walletRegistry.listWallets(chatId);
        if (wallets.isEmpty()) {
            return "You have no wallets to remove.";
        }
        chatSessions.transition(chatId, SessionState.AWAITING_REMOVAL_INDEX);
        return formatWallets(wallets) + "\n\nSend the number of the wallet to remove:";
    }

    private String addAddress(long chatId, String address, boolean fromSession) {
        if (!subscriptionService.isSubscribed(chatId)) {
            chatSessions.transition(chatId, SessionState.IDLE);
            return SUBSCRIBE_FIRST;
        }
        AddWalletResult result = walletRegistry.addWallet(chatId, address);
        if (!result.added()) {
            if (result.rejection() == AddWalletResult.Rejection.INVALID_ADDRESS) {
                if (fromSession) {
                    return "Invalid EVM address format. Please send a valid address (0x... with 42 characters).\n\n"
                            + "Or send /cancel to abort.";
                }
                return "Invalid EVM address format. Use /add 0x... with a 42-character address.";
            }
            chatSessions.transition(chatId, SessionState.IDLE);
            return "This wallet is already in your list!";
        }
        chatSessions.transition(chatId, SessionState.IDLE);
        int max = registryProperties.getMaxWalletsPerSubscriber();
        Optional<String> evicted = result.evictedAddress();
        if (evicted.isPresent()) {
            return "✓ Wallet added: " + EvmAddresses.shortForm(result.address()) + "\n\n"
                    + "You had " + max + " wallets. Removed oldest:\n" + EvmAddresses.shortForm(evicted.get());
        }
        int count = walletRegistry.listWallets(chatId).size();
        return "✓ Wallet added: " + EvmAddresses.shortForm(result.address()) + "\n\n"
                + "You now have " + count + "/" + max + " wallets.";
    }

    private String removeByIndex(long chatId, String input, boolean fromSession) {
        if (!subscriptionService.isSubscribed(chatId)) {
            chatSessions.transition(chatId, SessionState.IDLE);
            return SUBSCRIBE_FIRST;
        }
        int index;
        try {
            index = Integer.parseInt(input.trim());
        } catch (NumberFormatException e) {
            return fromSession ? "Please send a wallet number, or /cancel to abort." : "Usage: /remove <number>";
        }
        Optional<String> removed = walletRegistry.removeWalletAt(chatId, index);
        if (removed.isEmpty()) {
            return "No wallet #" + index + ". " + (fromSession ? "Send a number from the list, or /cancel." : "See /list.");
        }
        chatSessions.transition(chatId, SessionState.IDLE);
        return "✓ Wallet removed: " + EvmAddresses.shortForm(removed.get());
    }

    private String cancel(long chatId) {
        SessionState previous = chatSessions.stateOf(chatId);
        chatSessions.transition(chatId, SessionState.IDLE);
        return previous == SessionState.IDLE ? "Nothing to cancel." : "Cancelled.";
    }

    private String formatWallets(List<LinkedWallet> wallets) {
        StringBuilder sb = new StringBuilder("Your current wallets (")
                .append(wallets.size()).append('/').append(registryProperties.getMaxWalletsPerSubscriber()).append("):");
        for (int i = 0; i < wallets.size(); i++) {
            sb.append('\n').append(i + 1).append(". ").append(EvmAddresses.shortForm(wallets.get(i).address()));
        }
        return sb.toString();
    }
}
