package pass.IRPass.localopts.rules;

import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.User;
import ir.value.instructions.Instruction;
import pass.IRPass.localopts.ConstantOperand;
import pass.IRPass.localopts.LocalOptRule;
import pass.IRPass.localopts.RewriteUtils;
import util.LoggingManager;
import util.logging.Logger;

/**
 * {@code t = x + C; r = t - C} and {@code t = x - C; r = t + C}: every use of
 * {@code r} is redirected to {@code x}.
 *
 * <p>Only the immediate users of {@code t} are inspected. The constant is
 * looked up on either side for both opcodes, and the user's non-constant
 * operand is trusted to be {@code t}.
 */
public class InverseOpCancellationRule implements LocalOptRule {
    private static final Logger log = LoggingManager.getLogger(InverseOpCancellationRule.class);

    @Override
    public boolean apply(BasicBlock block) {
        boolean changed = false;
        for (Instruction inst = block.getFirstInstruction(); inst != null; inst = inst.getNext()) {
            Opcode op = inst.opCode();
            if (op != Opcode.ADD && op != Opcode.SUB) {
                continue;
            }
            ConstantOperand co = ConstantOperand.of(inst);
            if (co == null) {
                continue;
            }
            Opcode opposite = op == Opcode.ADD ? Opcode.SUB : Opcode.ADD;

            // snapshot, the rewrites below must not disturb this walk
            for (User user : inst.getUsers()) {
                if (!(user instanceof Instruction userInst) || userInst.opCode() != opposite) {
                    continue;
                }
                ConstantOperand userCo = ConstantOperand.of(userInst);
                if (userCo == null || !co.constant().bitEquals(userCo.constant())) {
                    continue;
                }
                log.debug("cancel {} against {}", userInst.toIR(), inst.toIR());
                changed |= RewriteUtils.replaceAllUses(userInst, co.other(), log);
            }
        }
        return changed;
    }
}
