package com.yhy.extrusion.controller;

import com.yhy.extrusion.service.OptimizationService;
import com.yhy.extrusion.vo.OptimizationResult;
import com.yhy.extrusion.vo.OptimizeRequest;
import com.yhy.extrusion.vo.R;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;


@RestController()
@RequestMapping(value = "api")
public class OptimizationController {

    private final OptimizationService optimizationService;

    public OptimizationController(OptimizationService optimizationService) {
        this.optimizationService = optimizationService;
    }

    @PostMapping(value = "optimize")
    public R<OptimizationResult> optimize(@Valid @RequestBody OptimizeRequest request) {
        return R.ok(optimizationService.optimize(request));
    }

}
