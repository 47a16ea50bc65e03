package xyz.firestige.rollout.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import xyz.firestige.rollout.facade.RolloutFacade;
import xyz.firestige.rollout.facade.dto.RolloutRequestDto;
import xyz.firestige.rollout.facade.dto.RolloutView;
import xyz.firestige.rollout.facade.dto.SubmissionView;

import java.util.List;

/**
 * 发布 REST 接口
 * <p>
 * POST /rollouts：新发布 202，幂等重放 200
 * GET /rollouts/{id}：状态、历史、当前流量分配
 * POST /rollouts/{id}/abort：中止，202
 * POST /rollouts/{id}/rollback：运维回滚，202
 */
@RestController
@RequestMapping("/rollouts")
public class RolloutRestController {

    private final RolloutFacade facade;

    public RolloutRestController(RolloutFacade facade) {
        this.facade = facade;
    }

    @PostMapping
    public ResponseEntity<SubmissionView> submit(@RequestBody RolloutRequestDto request) {
        SubmissionView view = facade.submit(request);
        HttpStatus status = view.replayed() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(view);
    }

    @GetMapping("/{id}")
    public RolloutView get(@PathVariable("id") String id) {
        return facade.get(id);
    }

    @GetMapping
    public List<RolloutView> list(@RequestParam("service") String serviceName) {
        return facade.listByService(serviceName);
    }

    @PostMapping("/{id}/abort")
    public ResponseEntity<RolloutView> abort(@PathVariable("id") String id,
                                             @RequestParam(value = "reason", required = false) String reason) {
        return ResponseEntity.accepted().body(facade.abort(id, reason));
    }

    @PostMapping("/{id}/rollback")
    public ResponseEntity<SubmissionView> rollback(@PathVariable("id") String id,
                                                   @RequestParam(value = "reason", required = false) String reason) {
        return ResponseEntity.accepted().body(facade.rollback(id, reason));
    }
}
