package net.miragecodex.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import net.miragecodex.application.credit.CreditLedgerService;
import net.miragecodex.controller.dto.CreditBalanceDto;
import net.miragecodex.controller.dto.TransactionPageDto;
import net.miragecodex.controller.support.CurrentUserResolver;
import net.miragecodex.controller.support.ErrorResponseUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Credit balance and ledger history of the signed-in user.
 */
@RestController
@RequestMapping("/api/user")
public class UserCreditController {

    private final CreditLedgerService creditLedger;
    private final CurrentUserResolver currentUserResolver;

    public UserCreditController(CreditLedgerService creditLedger, CurrentUserResolver currentUserResolver) {
        this.creditLedger = creditLedger;
        this.currentUserResolver = currentUserResolver;
    }

    @GetMapping("/credits")
    public ResponseEntity<?> credits(HttpServletRequest request) {
        Optional<String> userId = currentUserResolver.currentUser(request);
        if (userId.isEmpty()) {
            return ErrorResponseUtils.unauthorized("Sign in to view credits");
        }
        return ResponseEntity.ok(CreditBalanceDto.fromBalance(creditLedger.currentBalance(userId.get())));
    }

    @GetMapping("/transactions")
    public ResponseEntity<?> transactions(@RequestParam(defaultValue = "1") int page,
                                          @RequestParam(defaultValue = "20") int limit,
                                          HttpServletRequest request) {
        Optional<String> userId = currentUserResolver.currentUser(request);
        if (userId.isEmpty()) {
            return ErrorResponseUtils.unauthorized("Sign in to view transactions");
        }
        return ResponseEntity.ok(TransactionPageDto.fromPage(creditLedger.transactions(userId.get(), page, limit)));
    }
}
